package io.fetchbox.config;

import java.util.List;

/**
 * A named proxy pool: its own endpoints plus the pools to fall back to, in order.
 * Fallback names may carry a {@code pools/} prefix.
 *
 * <p>Pools carry no retry settings of their own: tier fallback happens within a
 * single attempt, and retry timing and budgets come from the global settings.
 * Per-pool {@code retryBackoffMs} or {@code maxRetries} keys in a settings file
 * are ignored.
 */
public record ProxyPoolConfig(List<String> primary, List<String> fallbacks) {
    public ProxyPoolConfig {
        primary = primary == null ? List.of() : List.copyOf(primary);
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
    }
}
