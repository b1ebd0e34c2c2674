package com.deploybot.orchestrator.model;

/**
 * Last observed status of one BuildSubmission.
 *
 * Legal transitions:
 *   SUBMITTED        → any other value
 *   PENDING          → RUNNING
 *   PENDING, RUNNING → SUCCESS | FAILURE | ABORTED | UNSTABLE
 *
 * Terminal values never change again. The monitor is the only writer.
 */
public enum BuildStatus {
    SUBMITTED,
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    ABORTED,
    UNSTABLE;

    public boolean isTerminal() {
        return switch (this) {
            case SUCCESS, FAILURE, ABORTED, UNSTABLE -> true;
            case SUBMITTED, PENDING, RUNNING -> false;
        };
    }

    /** True when moving from this status to {@code next} keeps the sequence monotonic. */
    public boolean canTransitionTo(BuildStatus next) {
        if (next == null || next == this || isTerminal()) {
            return false;
        }
        return switch (this) {
            case SUBMITTED -> true;
            case PENDING -> next == RUNNING || next.isTerminal();
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
