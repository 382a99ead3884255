package io.fetchbox.proxy;

import io.fetchbox.config.ProxyPoolConfig;
import io.fetchbox.config.SettingsValidator;
import io.fetchbox.model.ProxyEndpoint;
import io.fetchbox.model.ResolvedProxyPool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Flattens the proxy pool graph into fallback tiers.
 *
 * <p>Depth-first from the requested pool: each visited pool contributes its
 * primary list as one tier, then its fallbacks are visited in declared order.
 * A pool reachable through several paths (including a cycle back to an
 * ancestor) is visited once, at its first position. Results are cached per
 * name until {@link #reload(Map)} installs a new graph.
 */
public final class ProxyResolver {
    private volatile Map<String, ProxyPoolConfig> pools;
    private final ConcurrentMap<String, ResolvedProxyPool> cache;

    public ProxyResolver(Map<String, ProxyPoolConfig> pools) {
        this.pools = copy(pools);
        this.cache = new ConcurrentHashMap<>();
    }

    /**
     * @throws UnknownProxyPoolException when {@code poolName} or one of the pools
     *                                   it falls back to is not configured
     */
    public ResolvedProxyPool resolve(String poolName) {
        String root = SettingsValidator.stripPoolPrefix(poolName);
        ResolvedProxyPool cached = cache.get(root);
        if (cached != null) {
            return cached;
        }
        Map<String, ProxyPoolConfig> snapshot = pools;
        List<List<ProxyEndpoint>> tiers = new ArrayList<>();
        visit(snapshot, root, new HashSet<>(), tiers);
        ResolvedProxyPool resolved = new ResolvedProxyPool(tiers);
        synchronized (this) {
            if (snapshot == pools) {
                cache.putIfAbsent(root, resolved);
            }
        }
        return resolved;
    }

    public synchronized void reload(Map<String, ProxyPoolConfig> newPools) {
        this.pools = copy(newPools);
        cache.clear();
    }

    public int cachedPools() {
        return cache.size();
    }

    private void visit(Map<String, ProxyPoolConfig> graph, String name, Set<String> visited,
                       List<List<ProxyEndpoint>> tiers) {
        String poolName = SettingsValidator.stripPoolPrefix(name);
        if (!visited.add(poolName)) {
            return;
        }
        ProxyPoolConfig pool = graph.get(poolName);
        if (pool == null) {
            throw new UnknownProxyPoolException(poolName);
        }
        List<ProxyEndpoint> tier = new ArrayList<>(pool.primary().size());
        for (String uri : pool.primary()) {
            tier.add(ProxyEndpoint.parse(uri));
        }
        tiers.add(tier);
        for (String fallback : pool.fallbacks()) {
            visit(graph, fallback, visited, tiers);
        }
    }

    private static Map<String, ProxyPoolConfig> copy(Map<String, ProxyPoolConfig> source) {
        return source == null ? Map.of() : new LinkedHashMap<>(source);
    }
}
