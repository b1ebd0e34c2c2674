package com.deploybot.orchestrator.backend.jenkins;

import com.deploybot.orchestrator.backend.BackendException;
import com.deploybot.orchestrator.backend.BuildObservation;
import com.deploybot.orchestrator.backend.BuildRequest;
import com.deploybot.orchestrator.backend.HttpBackendSupport;
import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Jenkins remote-access API client.
 *
 * A build is triggered with buildWithParameters on the job
 * {@code <jobPrefix(environment)>/<service>}. Jenkins answers with a queue
 * item; the item is polled until it carries the build number. The build
 * reference stored for monitoring is {@code <job path>#<number>}.
 *
 * Authentication is HTTP Basic with the user's API token, which Jenkins
 * accepts without a CSRF crumb.
 */
@Component
public class JenkinsClient extends HttpBackendSupport {

    private static final Logger log = LoggerFactory.getLogger(JenkinsClient.class);

    private final Duration queueWaitTimeout;
    private final Duration queuePollInterval;

    public JenkinsClient(ObjectMapper objectMapper, DeployProperties properties) {
        super(objectMapper);
        this.queueWaitTimeout  = properties.dispatch().queueWaitTimeout();
        this.queuePollInterval = properties.dispatch().queuePollInterval();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.JENKINS;
    }

    // ------------------------------------------------------------------
    // Submit
    // ------------------------------------------------------------------

    @Override
    public String submit(BuildRequest request, ProjectSettings project) {
        BackendSettings jenkins = project.jenkins();
        requireBaseUrl(jenkins.baseUrl(), "Jenkins");

        String jobPath = jenkins.jobPrefix(request.environment()) + "/" + request.service();
        String jobUrl  = jobUrl(jenkins, jobPath);

        // Unknown job -> 404 -> REJECTED before anything is queued.
        JsonNode info = readTree(
                send(get(jenkins, jobUrl + "/api/json"), project.proxy(), "Jenkins job info " + jobPath).body(),
                "Jenkins job info " + jobPath);
        int expectedNumber = info.path("nextBuildNumber").asInt(0);
        if (!info.path("buildable").asBoolean(true)) {
            throw BackendException.rejected("Jenkins job " + jobPath + " is disabled");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("action_type",    "gray");
        params.put("gitBranch",      nullToEmpty(request.branch()));
        params.put("check_commitID", nullToEmpty(request.commitHash()));
        params.put("WORKFLOW_ID",    request.workflowId());
        params.put("PROJECT",        request.project());
        params.put("ENVIRONMENT",    request.environment());
        params.put("SERVICE",        request.service());
        params.put("APPROVER",       nullToEmpty(request.approver()));

        HttpRequest trigger = authorized(jenkins, HttpRequest.newBuilder()
                .uri(URI.create(jobUrl + "/buildWithParameters"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(query(params))))
                .build();
        HttpResponse<String> resp = send(trigger, project.proxy(), "Jenkins trigger " + jobPath);

        Optional<String> queueUrl = resp.headers().firstValue("Location");
        int number = queueUrl
                .map(url -> awaitBuildNumber(jenkins, project, url, jobPath))
                .orElse(0);
        if (number <= 0) {
            if (expectedNumber <= 0) {
                throw BackendException.rejected("Jenkins did not report a build number for " + jobPath);
            }
            log.warn("Queue item for {} did not resolve; assuming build #{}", jobPath, expectedNumber);
            number = expectedNumber;
        }

        log.info("Jenkins build {} #{} triggered for {}", jobPath, number, request.workflowId());
        return jobPath + "#" + number;
    }

    /**
     * Poll the queue item until Jenkins assigns an executable.
     *
     * @return the build number, or 0 if the wait timed out
     */
    private int awaitBuildNumber(BackendSettings jenkins, ProjectSettings project, String queueUrl, String jobPath) {
        String itemUrl = (queueUrl.endsWith("/") ? queueUrl : queueUrl + "/") + "api/json";
        Instant deadline = Instant.now().plus(queueWaitTimeout);
        while (true) {
            JsonNode item = readTree(
                    send(get(jenkins, itemUrl), project.proxy(), "Jenkins queue item " + jobPath).body(),
                    "Jenkins queue item " + jobPath);
            if (item.path("cancelled").asBoolean(false)) {
                throw BackendException.rejected("Jenkins queue item for " + jobPath + " was cancelled");
            }
            int number = item.path("executable").path("number").asInt(0);
            if (number > 0) {
                return number;
            }
            if (!Instant.now().isBefore(deadline)) {
                return 0;
            }
            try {
                Thread.sleep(queuePollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw BackendException.transientError("Interrupted waiting for Jenkins queue item " + jobPath, e);
            }
        }
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    @Override
    public BuildObservation pollStatus(String buildReference, ProjectSettings project) {
        BackendSettings jenkins = project.jenkins();
        requireBaseUrl(jenkins.baseUrl(), "Jenkins");

        int hash = buildReference.lastIndexOf('#');
        if (hash <= 0 || hash == buildReference.length() - 1) {
            throw BackendException.rejected("Malformed Jenkins build reference: " + buildReference);
        }
        String jobPath = buildReference.substring(0, hash);
        String number  = buildReference.substring(hash + 1);

        JsonNode build = readTree(
                send(get(jenkins, jobUrl(jenkins, jobPath) + "/" + number + "/api/json"),
                        project.proxy(), "Jenkins build " + buildReference).body(),
                "Jenkins build " + buildReference);

        String url = build.path("url").asText(null);
        long durationMs = build.path("duration").asLong(0);
        return new BuildObservation(mapStatus(build), url, durationMs);
    }

    static BuildStatus mapStatus(JsonNode build) {
        if (build.path("building").asBoolean(false)) {
            return BuildStatus.RUNNING;
        }
        JsonNode result = build.path("result");
        if (result.isMissingNode() || result.isNull()) {
            return BuildStatus.PENDING;
        }
        return switch (result.asText()) {
            case "SUCCESS"   -> BuildStatus.SUCCESS;
            case "FAILURE"   -> BuildStatus.FAILURE;
            case "UNSTABLE"  -> BuildStatus.UNSTABLE;
            case "ABORTED", "NOT_BUILT" -> BuildStatus.ABORTED;
            default          -> BuildStatus.RUNNING;
        };
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** "uat/api" -> {base}/job/uat/job/api */
    static String jobUrl(BackendSettings jenkins, String jobPath) {
        return jenkins.baseUrl() + Arrays.stream(jobPath.split("/"))
                .filter(s -> !s.isBlank())
                .map(s -> "/job/" + encode(s))
                .collect(Collectors.joining());
    }

    private HttpRequest get(BackendSettings jenkins, String url) {
        return authorized(jenkins, HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET())
                .build();
    }

    private static HttpRequest.Builder authorized(BackendSettings jenkins, HttpRequest.Builder builder) {
        if (jenkins.username() != null && !jenkins.username().isBlank()) {
            String credentials = jenkins.username() + ":" + nullToEmpty(jenkins.apiToken());
            builder.header("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return builder;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
