package io.fetchbox.proxy;

public final class UnknownProxyPoolException extends IllegalArgumentException {
    private final String poolName;

    public UnknownProxyPoolException(String poolName) {
        super("Proxy pool '" + poolName + "' not found");
        this.poolName = poolName;
    }

    public String poolName() {
        return poolName;
    }
}
