package io.fetchbox.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per job type defaults applied to tasks of that type.
 */
public record HandlerConfig(
        String storageBucket,
        Map<String, String> defaultHeaders,
        String proxyPool
) {
    public HandlerConfig {
        storageBucket = storageBucket == null || storageBucket.isBlank() ? null : storageBucket.trim();
        defaultHeaders = defaultHeaders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders));
        proxyPool = proxyPool == null || proxyPool.isBlank() ? null : proxyPool.trim();
    }
}
