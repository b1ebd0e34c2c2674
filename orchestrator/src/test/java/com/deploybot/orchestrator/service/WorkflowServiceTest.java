package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.config.BackendSettings;
import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.support.Fixtures;
import com.deploybot.orchestrator.support.InMemoryWorkflowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowServiceTest {

    InMemoryWorkflowStore store;
    WorkflowService       service;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
        service = new WorkflowService(store, Fixtures.catalog(Fixtures.properties(
                Fixtures.project(Fixtures.backend("http://jenkins", 0), BackendSettings.DISABLED))));
    }

    private static WorkflowDraft draft(List<String> services, List<String> hashes) {
        return new WorkflowDraft("shop", "UAT", " release/1.4 ", services, hashes, "notes",
                "1001", "dave", "-100200", null);
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_validDraft_pendingApprovalWithPairedTargets() {
        WorkflowRequest wf = service.create(draft(List.of("api", " web "), List.of("a1", "b2")));

        assertThat(wf.getApprovalState()).isEqualTo(ApprovalState.PENDING_APPROVAL);
        assertThat(wf.getCompositeState()).isEqualTo(CompositeState.PENDING);
        assertThat(wf.getBranch()).isEqualTo("release/1.4");
        assertThat(wf.getTargets()).containsExactly(new ServiceTarget("api", "a1"), new ServiceTarget("web", "b2"));
        assertThat(store.findWorkflow(wf.getId())).isPresent();
    }

    @Test
    void create_mismatchedLists_rejected() {
        assertThatThrownBy(() -> service.create(draft(List.of("api", "web"), List.of("a1"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 services but 1 commit hashes");
    }

    @Test
    void create_duplicateService_rejected() {
        assertThatThrownBy(() -> service.create(draft(List.of("api", "api"), List.of("a1", "a2"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void create_blankEntriesOrNoServices_rejected() {
        assertThatThrownBy(() -> service.create(draft(List.of("api", " "), List.of("a1", "a2"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.create(draft(List.of(), List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void create_unknownProject_rejected() {
        WorkflowDraft draft = new WorkflowDraft("ghost", "UAT", "main", List.of("api"), List.of("a1"), null,
                "1001", "dave", "-100200", null);

        assertThatThrownBy(() -> service.create(draft))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown project");
    }

    @Test
    void create_missingOriginChat_rejected() {
        WorkflowDraft draft = new WorkflowDraft("shop", "UAT", "main", List.of("api"), List.of("a1"), null,
                "1001", "dave", " ", null);

        assertThatThrownBy(() -> service.create(draft))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("originChatId");
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    @Test
    void get_unknown_throwsNotFound() {
        assertThatThrownBy(() -> service.get("WF-missing")).isInstanceOf(WorkflowNotFoundException.class);
    }

    @Test
    void history_onlyForSubmissionsOfThatWorkflow() {
        WorkflowRequest wf = store.createWorkflow(Fixtures.workflow("api"));
        BuildSubmission sub = store.saveBuildSubmission(
                BuildSubmission.submitted(wf.getId(), BackendKind.JENKINS, "api", "hash0", "uat/api#1"));
        store.updateBuildStatus(sub.getId(), BuildStatus.SUBMITTED, BuildStatus.RUNNING, null, null);

        assertThat(service.history(wf.getId(), sub.getId())).hasValueSatisfying(events ->
                assertThat(events).singleElement().satisfies(e -> {
                    assertThat(e.getFromStatus()).isEqualTo(BuildStatus.SUBMITTED);
                    assertThat(e.getToStatus()).isEqualTo(BuildStatus.RUNNING);
                }));
        assertThat(service.history("WF-other", sub.getId())).isEmpty();
        assertThat(service.history(wf.getId(), UUID.randomUUID())).isEmpty();
    }

    // ------------------------------------------------------------------
    // attachApprovalMessage()
    // ------------------------------------------------------------------

    @Test
    void attachApprovalMessage_onlyOnce() {
        WorkflowRequest wf = service.create(draft(List.of("api"), List.of("a1")));

        assertThat(service.attachApprovalMessage(wf.getId(), " 501 ")).isTrue();
        assertThat(service.attachApprovalMessage(wf.getId(), "502")).isFalse();
        assertThat(service.get(wf.getId()).getApprovalMessageId()).isEqualTo("501");
    }
}
