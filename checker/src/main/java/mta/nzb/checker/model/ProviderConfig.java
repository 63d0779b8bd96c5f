package mta.nzb.checker.model;

/**
 * ProviderConfig - One Usenet provider account.
 * Only enabled providers with a host take part in checks, in configured order.
 */
public record ProviderConfig(
    String name,
    String host,
    int port,
    boolean useTls,
    String username,
    String password,
    int maxConnections,
    boolean enabled
) {

    /**
     * True when this provider can be dialed.
     */
    public boolean usable() {
        return enabled && host != null && !host.isBlank();
    }

    /**
     * Connection budget, never below one.
     */
    public int connectionBudget() {
        return Math.max(1, maxConnections);
    }

    public String displayName() {
        return (name == null || name.isBlank()) ? host : name;
    }

    @Override
    public String toString() {
        // never print credentials
        return "ProviderConfig[name=" + name + ", host=" + host + ", port=" + port
                + ", useTls=" + useTls + ", maxConnections=" + maxConnections + ", enabled=" + enabled + "]";
    }
}
