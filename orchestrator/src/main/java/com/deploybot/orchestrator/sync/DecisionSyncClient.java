package com.deploybot.orchestrator.sync;

import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.store.WorkflowStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pushes a decided workflow to the external records API and marks it synced.
 *
 * Disabled when {@code deploybot.sync.base-url} is blank. A failed push is
 * logged and leaves the workflow unsynced; it never affects dispatch.
 */
@Component
public class DecisionSyncClient {

    private static final Logger log = LoggerFactory.getLogger(DecisionSyncClient.class);

    private final DeployProperties.Sync settings;
    private final ObjectMapper          json;
    private final WorkflowStore         store;
    private final HttpClient            http;

    public DecisionSyncClient(DeployProperties properties, ObjectMapper objectMapper, WorkflowStore store) {
        this.settings = properties.sync();
        this.json     = objectMapper;
        this.store    = store;
        this.http     = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean enabled() {
        return settings.enabled();
    }

    /**
     * POST the workflow and its decision.
     *
     * @return true when the API accepted it and the workflow was marked synced
     */
    public boolean sync(WorkflowRequest wf) {
        if (!settings.enabled()) {
            return false;
        }
        String url = stripSlash(settings.baseUrl()) + "/" + stripLeadingSlash(settings.endpoint());
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(settings.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload(wf))));
            if (settings.token() != null && !settings.token().isBlank()) {
                req.header("Authorization", "Bearer " + settings.token());
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("Sync of workflow {} rejected: HTTP {}: {}", wf.getId(), resp.statusCode(), resp.body());
                return false;
            }
        } catch (JsonProcessingException e) {
            log.error("Could not serialize workflow {} for sync", wf.getId(), e);
            return false;
        } catch (IOException e) {
            log.warn("Sync of workflow {} to {} failed: {}", wf.getId(), url, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sync of workflow {} interrupted", wf.getId());
            return false;
        }

        store.markSynced(wf.getId());
        log.info("Workflow {} synced to {}", wf.getId(), url);
        return true;
    }

    static Map<String, Object> payload(WorkflowRequest wf) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id",   wf.getId());
        body.put("user_id",       wf.getRequesterId());
        body.put("username",      wf.getRequesterName());
        body.put("project",       wf.getProject());
        body.put("environment",   wf.getEnvironment());
        body.put("branch",        wf.getBranch());
        body.put("services",      wf.getTargets().stream().map(ServiceTarget::getService).toList());
        body.put("hashes",        wf.getTargets().stream().map(ServiceTarget::getCommitHash).toList());
        body.put("release_notes", wf.getReleaseNotes());
        body.put("status",        wf.getApprovalState().name().toLowerCase(Locale.ROOT));
        body.put("approver_id",   wf.getDecidedBy());
        body.put("approval_time", wf.getDecidedAt() == null ? null : wf.getDecidedAt().toString());
        return body;
    }

    private static String stripSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String stripLeadingSlash(String s) {
        return s.startsWith("/") ? s.substring(1) : s;
    }
}
