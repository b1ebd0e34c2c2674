package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.BuildStatusEvent;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creation and read access for workflows.
 *
 * A workflow is immutable once created; decisions go through
 * ApprovalService and everything after that through the dispatcher and
 * the monitor.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowStore  store;
    private final ProjectCatalog catalog;

    public WorkflowService(WorkflowStore store, ProjectCatalog catalog) {
        this.store   = store;
        this.catalog = catalog;
    }

    /**
     * Validate and persist a new request in PENDING_APPROVAL.
     *
     * @throws IllegalArgumentException when the draft is incomplete, the project
     *         is unknown, or services and hashes do not line up
     */
    public WorkflowRequest create(WorkflowDraft draft) {
        requireText(draft.project(), "project");
        requireText(draft.environment(), "environment");
        requireText(draft.requesterId(), "requesterId");
        requireText(draft.originChatId(), "originChatId");
        if (catalog.find(draft.project()).isEmpty()) {
            throw new IllegalArgumentException("Unknown project: " + draft.project());
        }
        if (draft.services().isEmpty()) {
            throw new IllegalArgumentException("At least one service is required");
        }
        if (draft.services().size() != draft.hashes().size()) {
            throw new IllegalArgumentException("Got " + draft.services().size() + " services but "
                    + draft.hashes().size() + " commit hashes");
        }

        List<ServiceTarget> targets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < draft.services().size(); i++) {
            String service = trimToNull(draft.services().get(i));
            String hash    = trimToNull(draft.hashes().get(i));
            if (service == null || hash == null) {
                throw new IllegalArgumentException("Service and commit hash #" + (i + 1) + " must not be blank");
            }
            if (!seen.add(service)) {
                throw new IllegalArgumentException("Service listed twice: " + service);
            }
            targets.add(new ServiceTarget(service, hash));
        }

        String branch = draft.branch() == null ? "" : draft.branch().trim();
        WorkflowRequest saved = store.createWorkflow(new WorkflowRequest(
                draft.project().trim(), draft.environment().trim(), branch, targets, draft.releaseNotes(),
                draft.requesterId(), draft.requesterName(), draft.originChatId(),
                trimToNull(draft.approvalMessageId())));
        log.info("Workflow {} created by {} for {} / {}: {}", saved.getId(), draft.requesterId(),
                saved.getProject(), saved.getEnvironment(), targets);
        return saved;
    }

    public WorkflowRequest get(String workflowId) {
        return store.findWorkflow(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    public List<BuildSubmission> submissions(String workflowId) {
        get(workflowId);
        return store.findSubmissions(workflowId);
    }

    /** Status history of one submission; empty when it does not belong to the workflow. */
    public Optional<List<BuildStatusEvent>> history(String workflowId, UUID submissionId) {
        return store.findSubmission(submissionId)
                .filter(s -> s.getWorkflowId().equals(workflowId))
                .map(s -> store.statusHistory(submissionId));
    }

    /**
     * Remember the chat message that asks for approval, so the decision can edit it.
     *
     * @return false if a message id was already attached
     */
    public boolean attachApprovalMessage(String workflowId, String messageId) {
        requireText(messageId, "messageId");
        get(workflowId);
        return store.attachApprovalMessage(workflowId, messageId.trim());
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
