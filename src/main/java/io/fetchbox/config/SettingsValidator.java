package io.fetchbox.config;

import io.fetchbox.model.ProxyEndpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-field checks that clamping cannot repair: dangling pool references,
 * unusable proxy URIs and non-positive retention windows.
 */
public final class SettingsValidator {
    public static final String POOL_PREFIX = "pools/";

    private SettingsValidator() {
    }

    public static void validate(FetchBoxSettings settings) {
        List<String> errors = collectErrors(settings);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
    }

    static void validateRaw(SettingsFile file) {
        if (file == null) {
            return;
        }
        List<String> errors = new ArrayList<>();
        if (file.jobTtlDays() != null && file.jobTtlDays() <= 0) {
            errors.add("jobTtlDays must be > 0, got " + file.jobTtlDays());
        }
        if (file.logsTtlDays() != null && file.logsTtlDays() <= 0) {
            errors.add("logsTtlDays must be > 0, got " + file.logsTtlDays());
        }
        if (file.baseBackoffMs() != null && file.maxBackoffMs() != null
                && file.maxBackoffMs() < file.baseBackoffMs()) {
            errors.add("maxBackoffMs (" + file.maxBackoffMs() + ") must be >= baseBackoffMs (" + file.baseBackoffMs() + ")");
        }
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
    }

    public static List<String> collectErrors(FetchBoxSettings settings) {
        List<String> errors = new ArrayList<>();
        Map<String, ProxyPoolConfig> pools = settings.proxyPools();
        for (Map.Entry<String, ProxyPoolConfig> e : pools.entrySet()) {
            String pool = e.getKey();
            ProxyPoolConfig cfg = e.getValue();
            if (cfg == null) {
                errors.add("proxy pool '" + pool + "' has no definition");
                continue;
            }
            for (String uri : cfg.primary()) {
                try {
                    ProxyEndpoint.parse(uri);
                } catch (IllegalArgumentException ex) {
                    errors.add("proxy pool '" + pool + "': " + ex.getMessage());
                }
            }
            for (String fallback : cfg.fallbacks()) {
                if (!pools.containsKey(stripPoolPrefix(fallback))) {
                    errors.add("proxy pool '" + pool + "' falls back to unknown pool '" + fallback + "'");
                }
            }
        }
        for (Map.Entry<String, HandlerConfig> e : settings.handlers().entrySet()) {
            HandlerConfig handler = e.getValue();
            if (handler == null || handler.proxyPool() == null) {
                continue;
            }
            if (!pools.containsKey(stripPoolPrefix(handler.proxyPool()))) {
                errors.add("handler '" + e.getKey() + "' references unknown proxy pool '" + handler.proxyPool() + "'");
            }
        }
        return errors;
    }

    public static String stripPoolPrefix(String name) {
        if (name == null) {
            return "";
        }
        String value = name.trim();
        return value.startsWith(POOL_PREFIX) ? value.substring(POOL_PREFIX.length()) : value;
    }
}
