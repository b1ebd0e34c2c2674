package com.deploybot.orchestrator.model;

/**
 * Approval decision attached to a WorkflowRequest.
 *
 * Transitions:
 *   PENDING_APPROVAL → APPROVED
 *   PENDING_APPROVAL → REJECTED
 *
 * The transition out of PENDING_APPROVAL happens at most once; the store
 * enforces it with a compare-and-set on this column.
 */
public enum ApprovalState {
    PENDING_APPROVAL,
    APPROVED,
    REJECTED
}
