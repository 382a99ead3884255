package io.fetchbox.model;

public enum QueueStatus {
    PENDING,
    LEASED,
    COMPLETED,
    DEAD_LETTERED;

    public boolean terminal() {
        return this == COMPLETED || this == DEAD_LETTERED;
    }

    public static QueueStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("queue status must not be blank");
        }
        for (QueueStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown queue status: " + raw);
    }
}
