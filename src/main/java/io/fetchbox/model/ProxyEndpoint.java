package io.fetchbox.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * An HTTP proxy the downloader can route through. {@link #DIRECT} means no proxy.
 */
public record ProxyEndpoint(String uri, String host, int port) {
    public static final ProxyEndpoint DIRECT = new ProxyEndpoint("direct", "", 0);

    public boolean direct() {
        return "direct".equals(uri);
    }

    public static ProxyEndpoint parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("proxy uri must not be blank");
        }
        String value = raw.trim();
        if ("direct".equalsIgnoreCase(value)) {
            return DIRECT;
        }
        URI parsed;
        try {
            parsed = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid proxy uri: " + raw, e);
        }
        String scheme = parsed.getScheme() == null ? "" : parsed.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme)) {
            throw new IllegalArgumentException("Unsupported proxy scheme (only http): " + raw);
        }
        if (parsed.getHost() == null || parsed.getHost().isBlank()) {
            throw new IllegalArgumentException("Proxy uri has no host: " + raw);
        }
        int port = parsed.getPort() > 0 ? parsed.getPort() : 80;
        return new ProxyEndpoint("http://" + parsed.getHost() + ":" + port, parsed.getHost(), port);
    }

    @Override
    public String toString() {
        return uri;
    }
}
