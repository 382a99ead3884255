package io.fetchbox.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Destination override supplied by whoever produced the task. Blank fields fall
 * back to configured defaults.
 */
public record StorageHint(
        String bucket,
        String keyPrefix,
        Map<String, String> metadata
) {
    public StorageHint {
        bucket = bucket == null ? "" : bucket.trim();
        keyPrefix = keyPrefix == null ? "" : trimSlashes(keyPrefix.trim());
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    private static String trimSlashes(String raw) {
        String value = raw;
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
