package io.fetchbox.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered fallback tiers. Tier order is the order tried; within a tier,
 * endpoints are tried in list order.
 */
public record ResolvedProxyPool(List<List<ProxyEndpoint>> tiers) {
    public ResolvedProxyPool {
        List<List<ProxyEndpoint>> copy = new ArrayList<>();
        if (tiers != null) {
            for (List<ProxyEndpoint> tier : tiers) {
                copy.add(tier == null ? List.of() : List.copyOf(tier));
            }
        }
        tiers = List.copyOf(copy);
    }

    public static ResolvedProxyPool direct() {
        return new ResolvedProxyPool(List.of(List.of(ProxyEndpoint.DIRECT)));
    }

    public int endpointCount() {
        int total = 0;
        for (List<ProxyEndpoint> tier : tiers) {
            total += tier.size();
        }
        return total;
    }

    public boolean structurallyEmpty() {
        return endpointCount() == 0;
    }
}
