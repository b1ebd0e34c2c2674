package com.deploybot.orchestrator.backend.jenkins;

import com.deploybot.orchestrator.backend.BackendException;
import com.deploybot.orchestrator.backend.BuildObservation;
import com.deploybot.orchestrator.backend.BuildRequest;
import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.notFound;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JenkinsClientTest {

    @RegisterExtension
    static final WireMockExtension JENKINS = WireMockExtension.newInstance()
            .options(WireMockConfiguration.wireMockConfig().dynamicPort())
            .build();

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final BuildRequest REQUEST = new BuildRequest("WF-20240305101530-a1b2c3", "shop", "UAT",
            "release/1.4", "api", "9f1c2e", "alice", "Fix checkout totals");

    private static final String JOB = "/job/uat/job/api";

    private static JenkinsClient client() {
        DeployProperties properties = new DeployProperties(null,
                new DeployProperties.Dispatch(1, Duration.ofMillis(10), Duration.ofMillis(200), Duration.ofMillis(10)),
                null, null, null, Map.of());
        return new JenkinsClient(JSON, properties);
    }

    private static ProjectSettings project() {
        return project(JENKINS.baseUrl());
    }

    private static ProjectSettings project(String baseUrl) {
        return Fixtures.project(Fixtures.backend(baseUrl, 0), BackendSettings.DISABLED);
    }

    private static void stubJob(int nextBuildNumber) {
        JENKINS.stubFor(get(urlEqualTo(JOB + "/api/json"))
                .willReturn(okJson("{\"nextBuildNumber\": " + nextBuildNumber + ", \"buildable\": true}")));
    }

    private static void stubTrigger() {
        JENKINS.stubFor(post(urlEqualTo(JOB + "/buildWithParameters"))
                .willReturn(aResponse().withStatus(201)
                        .withHeader("Location", JENKINS.baseUrl() + "/queue/item/5/")));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_waitsForQueueItemAndReturnsJobPathWithNumber() {
        stubJob(12);
        stubTrigger();
        JENKINS.stubFor(get(urlEqualTo("/queue/item/5/api/json"))
                .willReturn(okJson("""
                        {"cancelled": false, "executable": {"number": 12, "url": "http://jenkins/job/uat/job/api/12/"}}
                        """)));

        String reference = client().submit(REQUEST, project());

        assertThat(reference).isEqualTo("uat/api#12");
        JENKINS.verify(postRequestedFor(urlEqualTo(JOB + "/buildWithParameters"))
                .withHeader("Authorization", equalTo("Basic ZGVwbG95Ym90OnRva2Vu"))
                .withHeader("Content-Type", equalTo("application/x-www-form-urlencoded"))
                .withRequestBody(containing("action_type=gray"))
                .withRequestBody(containing("gitBranch=release%2F1.4"))
                .withRequestBody(containing("check_commitID=9f1c2e"))
                .withRequestBody(containing("WORKFLOW_ID=WF-20240305101530-a1b2c3"))
                .withRequestBody(containing("APPROVER=alice")));
    }

    @Test
    void submit_queueItemNeverResolves_fallsBackToNextBuildNumber() {
        stubJob(31);
        stubTrigger();
        JENKINS.stubFor(get(urlEqualTo("/queue/item/5/api/json"))
                .willReturn(okJson("{\"cancelled\": false, \"why\": \"Waiting for next available executor\"}")));

        assertThat(client().submit(REQUEST, project())).isEqualTo("uat/api#31");
    }

    @Test
    void submit_cancelledQueueItem_rejected() {
        stubJob(12);
        stubTrigger();
        JENKINS.stubFor(get(urlEqualTo("/queue/item/5/api/json"))
                .willReturn(okJson("{\"cancelled\": true}")));

        assertThatThrownBy(() -> client().submit(REQUEST, project()))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isTransient()).isFalse())
                .hasMessageContaining("cancelled");
    }

    @Test
    void submit_unknownJob_rejectedWithoutTriggering() {
        JENKINS.stubFor(get(urlEqualTo(JOB + "/api/json")).willReturn(notFound()));

        assertThatThrownBy(() -> client().submit(REQUEST, project()))
                .isInstanceOfSatisfying(BackendException.class, e ->
                        assertThat(e.getKind()).isEqualTo(BackendException.Kind.REJECTED))
                .hasMessageContaining("HTTP 404");
        JENKINS.verify(0, postRequestedFor(urlPathMatching(".*/buildWithParameters")));
    }

    @Test
    void submit_disabledJob_rejected() {
        JENKINS.stubFor(get(urlEqualTo(JOB + "/api/json"))
                .willReturn(okJson("{\"nextBuildNumber\": 3, \"buildable\": false}")));

        assertThatThrownBy(() -> client().submit(REQUEST, project()))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("disabled");
    }

    @Test
    void submit_serverError_isTransient() {
        stubJob(12);
        JENKINS.stubFor(post(urlEqualTo(JOB + "/buildWithParameters"))
                .willReturn(aResponse().withStatus(503).withBody("Jenkins is restarting")));

        assertThatThrownBy(() -> client().submit(REQUEST, project()))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void submit_connectionRefused_isTransient() {
        assertThatThrownBy(() -> client().submit(REQUEST, project("http://localhost:1")))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void submit_missingBaseUrl_rejected() {
        assertThatThrownBy(() -> client().submit(REQUEST, project(null)))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isTransient()).isFalse());
    }

    // ------------------------------------------------------------------
    // pollStatus()
    // ------------------------------------------------------------------

    @Test
    void pollStatus_finishedBuild() {
        JENKINS.stubFor(get(urlEqualTo(JOB + "/12/api/json"))
                .willReturn(okJson("""
                        {"building": false, "result": "SUCCESS", "duration": 61000,
                         "url": "http://jenkins/job/uat/job/api/12/"}
                        """)));

        BuildObservation observation = client().pollStatus("uat/api#12", project());

        assertThat(observation.status()).isEqualTo(BuildStatus.SUCCESS);
        assertThat(observation.detailUrl()).isEqualTo("http://jenkins/job/uat/job/api/12/");
        assertThat(observation.durationMs()).isEqualTo(61000);
    }

    @Test
    void pollStatus_malformedReference_rejected() {
        assertThatThrownBy(() -> client().pollStatus("uat/api", project()))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void mapStatus() throws Exception {
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"building\": true, \"result\": null}")))
                .isEqualTo(BuildStatus.RUNNING);
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"building\": false, \"result\": null}")))
                .isEqualTo(BuildStatus.PENDING);
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"result\": \"FAILURE\"}")))
                .isEqualTo(BuildStatus.FAILURE);
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"result\": \"UNSTABLE\"}")))
                .isEqualTo(BuildStatus.UNSTABLE);
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"result\": \"NOT_BUILT\"}")))
                .isEqualTo(BuildStatus.ABORTED);
        assertThat(JenkinsClient.mapStatus(JSON.readTree("{\"result\": \"ABORTED\"}")))
                .isEqualTo(BuildStatus.ABORTED);
    }

    @Test
    void jobUrl_nestsFolders() {
        BackendSettings settings = Fixtures.backend("http://jenkins:8080/", 0);

        assertThat(JenkinsClient.jobUrl(settings, "gray-uat/order service"))
                .isEqualTo("http://jenkins:8080/job/gray-uat/job/order%20service");
    }
}
