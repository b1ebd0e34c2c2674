package com.deploybot.orchestrator.config;

/**
 * HTTP proxy used for one project's backend traffic (or for chat delivery).
 *
 * java.net.http only speaks HTTP CONNECT proxies; a SOCKS type is reported
 * and ignored when the client is built.
 */
public record ProxySettings(
        boolean enabled,
        String  type,
        String  host,
        int     port,
        String  username,
        String  password
) {
    public static final ProxySettings NONE = new ProxySettings(false, "http", null, 0, null, null);

    public ProxySettings {
        if (type == null || type.isBlank()) type = "http";
    }

    /** True when the proxy is switched on and has a usable address. */
    public boolean usable() {
        return enabled && host != null && !host.isBlank() && port > 0;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null;
    }

    public boolean isHttp() {
        return "http".equalsIgnoreCase(type) || "https".equalsIgnoreCase(type);
    }
}
