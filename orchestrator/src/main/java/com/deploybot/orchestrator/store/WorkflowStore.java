package com.deploybot.orchestrator.store;

import com.deploybot.orchestrator.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Single source of truth for workflows, build submissions and their history.
 *
 * Every mutation that depends on previously read state is a compare-and-set:
 * it names the expected prior value and reports whether it won. The store
 * makes each call atomic; callers never update from stale state without one
 * of these guards.
 *
 * Failures of the underlying storage propagate as unchecked exceptions and
 * are never swallowed here.
 */
public interface WorkflowStore {

    WorkflowRequest createWorkflow(WorkflowRequest workflow);

    Optional<WorkflowRequest> findWorkflow(String workflowId);

    /** Moves the approval state from {@code expected} to {@code next}; false if it was not {@code expected}. */
    boolean compareAndSetApproval(String workflowId, ApprovalState expected, ApprovalState next,
                                  String actor, Instant at);

    /** Moves the composite state to {@code next} if it is currently one of {@code expected}. */
    boolean compareAndSetComposite(String workflowId, Set<CompositeState> expected, CompositeState next);

    /** Sets the approval prompt message id if none is set yet. */
    boolean attachApprovalMessage(String workflowId, String messageId);

    void markSynced(String workflowId);

    /** Approved-or-not workflows sitting in a given composite state (startup recovery). */
    List<WorkflowRequest> listWorkflows(ApprovalState approvalState, CompositeState compositeState);

    BuildSubmission saveBuildSubmission(BuildSubmission submission);

    Optional<BuildSubmission> findSubmission(UUID submissionId);

    List<BuildSubmission> findSubmissions(String workflowId);

    /**
     * Write-through of an observed status, with a history row.
     *
     * @return false when the stored status was no longer {@code expected}
     */
    boolean updateBuildStatus(UUID submissionId, BuildStatus expected, BuildStatus next,
                              String reason, String detailUrl);

    List<BuildStatusEvent> statusHistory(UUID submissionId);

    /** Submissions whose monitoring has to resume after a restart. */
    List<BuildSubmission> listNonTerminalSubmissions();

    /** Ids of workflows created before {@code cutoff}. */
    List<String> listExpired(Instant cutoff);

    /** Deletes a workflow together with its submissions and history. */
    void delete(String workflowId);
}
