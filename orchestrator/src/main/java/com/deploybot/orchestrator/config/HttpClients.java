package com.deploybot.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds java.net.http clients that honour a {@link ProxySettings}.
 *
 * HttpClient instances are thread-safe and pool their connections, so
 * callers build one per distinct proxy and keep it.
 */
public final class HttpClients {

    private static final Logger log = LoggerFactory.getLogger(HttpClients.class);

    private HttpClients() {}

    public static HttpClient build(ProxySettings proxy, Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (proxy != null && proxy.usable()) {
            if (!proxy.isHttp()) {
                log.warn("Proxy type '{}' is not supported by the HTTP client; connecting directly", proxy.type());
                return builder.build();
            }
            builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.host(), proxy.port())));
            if (proxy.hasCredentials()) {
                String user = proxy.username();
                char[] password = proxy.password().toCharArray();
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        if (getRequestorType() == RequestorType.PROXY) {
                            return new PasswordAuthentication(user, password);
                        }
                        return null;
                    }
                });
            }
            log.debug("HTTP client using proxy {}:{}", proxy.host(), proxy.port());
        }
        return builder.build();
    }
}
