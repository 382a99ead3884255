package io.fetchbox.config;

import java.util.List;

public final class ConfigValidationException extends RuntimeException {
    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super("Invalid fetchbox settings: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
