package com.deploybot.orchestrator.backend;

import com.deploybot.orchestrator.config.HttpClients;
import com.deploybot.orchestrator.config.ProxySettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Shared plumbing of the HTTP backend clients.
 *
 * One HttpClient is kept per distinct proxy configuration. Failures are
 * classified here so both backends agree on what is worth retrying:
 * I/O errors, timeouts and 5xx are TRANSIENT, other non-2xx answers are
 * REJECTED.
 */
public abstract class HttpBackendSupport implements BackendClient {

    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration CONNECT_TIMEOUT   = Duration.ofSeconds(10);

    protected final ObjectMapper json;

    private final Map<ProxySettings, HttpClient> clients = new ConcurrentHashMap<>();

    protected HttpBackendSupport(ObjectMapper json) {
        this.json = json;
    }

    // ------------------------------------------------------------------
    // Request helpers
    // ------------------------------------------------------------------

    /**
     * Send a request and return the response if it is 2xx.
     *
     * @throws BackendException TRANSIENT or REJECTED, see class comment
     */
    protected HttpResponse<String> send(HttpRequest request, ProxySettings proxy, String opName) {
        HttpResponse<String> resp;
        try {
            resp = client(proxy).send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw BackendException.transientError(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BackendException.transientError(opName + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp;
        }
        String message = opName + " failed: HTTP " + status + ": " + abbreviate(resp.body());
        if (status >= 500) {
            throw new BackendException(BackendException.Kind.TRANSIENT, message);
        }
        throw BackendException.rejected(message);
    }

    /** Parse a response body; a body that is not JSON means the backend answered something we cannot use. */
    protected JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.REJECTED,
                    opName + " returned malformed JSON", e);
        }
    }

    protected String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BackendException(BackendException.Kind.REJECTED, "JSON serialization failed", e);
        }
    }

    protected static String query(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue() == null ? "" : e.getValue()))
                .collect(Collectors.joining("&"));
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    protected static void requireBaseUrl(String baseUrl, String backend) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw BackendException.rejected(backend + " base URL is not configured");
        }
    }

    private HttpClient client(ProxySettings proxy) {
        ProxySettings key = proxy == null ? ProxySettings.NONE : proxy;
        return clients.computeIfAbsent(key, p -> HttpClients.build(p, CONNECT_TIMEOUT));
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
