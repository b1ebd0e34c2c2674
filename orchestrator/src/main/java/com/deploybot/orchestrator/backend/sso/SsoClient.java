package com.deploybot.orchestrator.backend.sso;

import com.deploybot.orchestrator.backend.BackendException;
import com.deploybot.orchestrator.backend.BuildObservation;
import com.deploybot.orchestrator.backend.BuildRequest;
import com.deploybot.orchestrator.backend.HttpBackendSupport;
import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the SSO release-order system.
 *
 * Submitting is three calls: look up the SSO job id of the service
 * (queryOaSameJob), start a dcAutoReleaseProcess order for it and keep the
 * returned processInstanceId as the build reference. Polling resolves the
 * release id of that process (getReleaseId) and reads its publishStatus
 * (buildDetail). Until SSO has created the release the build is PENDING.
 */
@Component
public class SsoClient extends HttpBackendSupport {

    private static final Logger log = LoggerFactory.getLogger(SsoClient.class);

    static final String JOB_LOOKUP_PATH   = "/api/publish3/publish/jenkinsJob/queryOaSameJob";
    static final String START_ORDER_PATH  = "/api/flow/task/startnew/" + SsoOrderFormatter.PROCESS_TYPE;
    static final String RELEASE_ID_PATH   = "/api/flow/publish/hisitory/getReleaseId";
    static final String BUILD_DETAIL_PATH = "/api/flow/publish/hisitory/buildDetail";

    private final Clock clock;

    @Autowired
    public SsoClient(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    SsoClient(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper);
        this.clock = clock;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.SSO;
    }

    // ------------------------------------------------------------------
    // Submit
    // ------------------------------------------------------------------

    @Override
    public String submit(BuildRequest request, ProjectSettings project) {
        BackendSettings sso = project.sso();
        requireBaseUrl(sso.baseUrl(), "SSO");

        String jobId = findJobId(sso, project, request);

        Map<String, Object> order = new LinkedHashMap<>(
                SsoOrderFormatter.format(request, jobId, sso.userId(), LocalDateTime.now(clock)));
        // The API wants the form as a JSON string, not as nested JSON.
        order.put("detail", toJson(order.get("detail")));

        HttpRequest start = headers(sso, HttpRequest.newBuilder()
                .uri(URI.create(sso.baseUrl() + START_ORDER_PATH))
                .timeout(REQUEST_TIMEOUT.multipliedBy(2))
                .POST(HttpRequest.BodyPublishers.ofString(toJson(order))))
                .build();
        JsonNode resp = readTree(send(start, project.proxy(), "SSO order " + request.service()).body(),
                "SSO order " + request.service());

        String processInstanceId = resp.path("object").path("processInstanceId").asText("");
        if (processInstanceId.isBlank()) {
            throw BackendException.rejected("SSO order for " + request.service()
                    + " returned no processInstanceId: " + resp.path("message").asText(resp.toString()));
        }
        log.info("SSO order {} started for {} / {}", processInstanceId, request.workflowId(), request.service());
        return processInstanceId;
    }

    private String findJobId(BackendSettings sso, ProjectSettings project, BuildRequest request) {
        String url = sso.baseUrl() + JOB_LOOKUP_PATH + "?"
                + query(Map.of("env", request.environment(), "projects", request.project()));
        JsonNode resp = readTree(send(get(sso, url), project.proxy(), "SSO job lookup").body(), "SSO job lookup");

        for (JsonNode job : resp.path("data")) {
            if (job.path("jobName").asText("").contains(request.service())) {
                String jobId = job.path("jobId").asText("");
                if (!jobId.isBlank()) {
                    log.debug("SSO job {} matched service {}", jobId, request.service());
                    return jobId;
                }
            }
        }
        throw BackendException.rejected("No SSO job for service " + request.service()
                + " in " + request.project() + "/" + request.environment());
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    @Override
    public BuildObservation pollStatus(String buildReference, ProjectSettings project) {
        BackendSettings sso = project.sso();
        requireBaseUrl(sso.baseUrl(), "SSO");

        JsonNode ids = readTree(send(get(sso, sso.baseUrl() + RELEASE_ID_PATH + "?" + query(Map.of("proId", buildReference))),
                project.proxy(), "SSO release id " + buildReference).body(), "SSO release id " + buildReference);
        String releaseId = null;
        for (JsonNode id : ids.path("object")) {
            if (!id.asText("").isBlank()) {
                releaseId = id.asText();
                break;
            }
        }
        if (releaseId == null) {
            return BuildObservation.of(BuildStatus.PENDING);
        }

        JsonNode detail = readTree(send(get(sso, sso.baseUrl() + BUILD_DETAIL_PATH + "?" + query(Map.of("id", releaseId))),
                project.proxy(), "SSO build detail " + releaseId).body(), "SSO build detail " + releaseId);
        JsonNode data = detail.path("data");
        String url = data.path("buildUrl").asText(null);
        return new BuildObservation(mapStatus(data.path("publishStatus").asText("")), url, 0);
    }

    static BuildStatus mapStatus(String publishStatus) {
        return switch (publishStatus) {
            case "SUCCESS" -> BuildStatus.SUCCESS;
            case "FAILURE" -> BuildStatus.FAILURE;
            case "ABORTED" -> BuildStatus.ABORTED;
            case ""        -> BuildStatus.PENDING;
            default        -> BuildStatus.RUNNING;
        };
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest get(BackendSettings sso, String url) {
        return headers(sso, HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .GET())
                .build();
    }

    private static HttpRequest.Builder headers(BackendSettings sso, HttpRequest.Builder builder) {
        builder.header("Content-Type", "application/json; charset=UTF-8")
               .header("Accept", "application/json");
        if (sso.authToken() != null)     builder.header("Auth-token", sso.authToken());
        if (sso.authorization() != null) builder.header("Authorization", sso.authorization());
        return builder;
    }
}
