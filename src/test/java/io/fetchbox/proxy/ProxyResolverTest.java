package io.fetchbox.proxy;

import io.fetchbox.config.ProxyPoolConfig;
import io.fetchbox.model.ProxyEndpoint;
import io.fetchbox.model.ResolvedProxyPool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ProxyResolverTest {

    @Test
    void flattensDepthFirstAndVisitsSharedPoolOnce() {
        Map<String, ProxyPoolConfig> pools = new LinkedHashMap<>();
        pools.put("main", new ProxyPoolConfig(List.of("http://a:8080", "http://b:8080"), List.of("regional", "pools/backup")));
        pools.put("regional", new ProxyPoolConfig(List.of("http://c:8080"), List.of("backup")));
        pools.put("backup", new ProxyPoolConfig(List.of("http://d:3128"), List.of()));

        ResolvedProxyPool resolved = new ProxyResolver(pools).resolve("main");

        Assertions.assertEquals(List.of(
                List.of("http://a:8080", "http://b:8080"),
                List.of("http://c:8080"),
                List.of("http://d:3128")
        ), uris(resolved));
        Assertions.assertEquals(4, resolved.endpointCount());
    }

    @Test
    void cycleBackToAncestorIsSkipped() {
        Map<String, ProxyPoolConfig> pools = new LinkedHashMap<>();
        pools.put("x", new ProxyPoolConfig(List.of("http://x:1"), List.of("y")));
        pools.put("y", new ProxyPoolConfig(List.of("http://y:1"), List.of("x")));

        ResolvedProxyPool resolved = new ProxyResolver(pools).resolve("pools/y");

        Assertions.assertEquals(List.of(List.of("http://y:1"), List.of("http://x:1")), uris(resolved));
    }

    @Test
    void poolWithNoEndpointsIsStructurallyEmpty() {
        Map<String, ProxyPoolConfig> pools = Map.of("empty", new ProxyPoolConfig(List.of(), List.of()));
        ResolvedProxyPool resolved = new ProxyResolver(pools).resolve("empty");
        Assertions.assertTrue(resolved.structurallyEmpty());
        Assertions.assertEquals(1, resolved.tiers().size());
    }

    @Test
    void unknownPoolIsRejected() {
        Map<String, ProxyPoolConfig> pools = Map.of("main", new ProxyPoolConfig(List.of("http://a:1"), List.of("gone")));
        ProxyResolver resolver = new ProxyResolver(pools);
        UnknownProxyPoolException missingRoot = Assertions.assertThrows(UnknownProxyPoolException.class,
                () -> resolver.resolve("nope"));
        Assertions.assertEquals("nope", missingRoot.poolName());
        UnknownProxyPoolException missingFallback = Assertions.assertThrows(UnknownProxyPoolException.class,
                () -> resolver.resolve("main"));
        Assertions.assertEquals("gone", missingFallback.poolName());
        Assertions.assertEquals(0, resolver.cachedPools());
    }

    @Test
    void reloadInvalidatesCache() {
        ProxyResolver resolver = new ProxyResolver(Map.of("main", new ProxyPoolConfig(List.of("http://old:1"), List.of())));
        ResolvedProxyPool first = resolver.resolve("main");
        Assertions.assertSame(first, resolver.resolve("main"));
        Assertions.assertEquals(1, resolver.cachedPools());

        resolver.reload(Map.of("main", new ProxyPoolConfig(List.of("http://new:2"), List.of())));
        Assertions.assertEquals(0, resolver.cachedPools());
        Assertions.assertEquals(List.of(List.of("http://new:2")), uris(resolver.resolve("main")));
    }

    private static List<List<String>> uris(ResolvedProxyPool pool) {
        List<List<String>> out = new ArrayList<>();
        for (List<ProxyEndpoint> tier : pool.tiers()) {
            out.add(tier.stream().map(ProxyEndpoint::uri).toList());
        }
        return out;
    }
}
