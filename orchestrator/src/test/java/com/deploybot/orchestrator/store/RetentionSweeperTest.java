package com.deploybot.orchestrator.store;

import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.support.Fixtures;
import com.deploybot.orchestrator.support.InMemoryWorkflowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionSweeperTest {

    InMemoryWorkflowStore store;
    RetentionSweeper      sweeper;

    @BeforeEach
    void setUp() {
        store   = new InMemoryWorkflowStore();
        sweeper = new RetentionSweeper(store, Fixtures.properties());
    }

    @Test
    void sweep_withinWindow_keepsEverything() {
        WorkflowRequest wf = store.createWorkflow(Fixtures.workflow("api"));

        assertThat(sweeper.sweep(Instant.now().plus(Duration.ofDays(59)))).isZero();
        assertThat(store.findWorkflow(wf.getId())).isPresent();
    }

    @Test
    void sweep_pastWindow_deletesWorkflowWithSubmissionsAndHistory() {
        WorkflowRequest wf = store.createWorkflow(Fixtures.workflow("api"));
        BuildSubmission sub = store.saveBuildSubmission(
                BuildSubmission.submitted(wf.getId(), BackendKind.JENKINS, "api", "hash0", "uat/api#1"));
        store.updateBuildStatus(sub.getId(), BuildStatus.SUBMITTED, BuildStatus.SUCCESS, null, null);

        assertThat(sweeper.sweep(Instant.now().plus(Duration.ofDays(61)))).isEqualTo(1);

        assertThat(store.findWorkflow(wf.getId())).isEmpty();
        assertThat(store.findSubmissions(wf.getId())).isEmpty();
        assertThat(store.statusHistory(sub.getId())).isEmpty();
    }
}
