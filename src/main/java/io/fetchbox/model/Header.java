package io.fetchbox.model;

public record Header(String name, String value) {
    public Header {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        value = value == null ? "" : value;
    }
}
