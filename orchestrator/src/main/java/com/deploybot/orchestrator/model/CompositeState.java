package com.deploybot.orchestrator.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Workflow-level progress once a decision has been taken.
 *
 * Happy path:
 *   PENDING → DISPATCHING → MONITORING → COMPLETED
 *
 * MONITORING ends in COMPLETED, PARTIALLY_FAILED or FAILED once every
 * submission is terminal. DISPATCHING goes straight to FAILED when every
 * submission attempt failed, or to NO_BACKEND when the project enables none.
 * PENDING → REJECTED on a reject decision.
 */
public enum CompositeState {
    PENDING,
    DISPATCHING,
    MONITORING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED,
    REJECTED,
    NO_BACKEND;

    private static final Set<BuildStatus> FAILED_STATUSES =
            EnumSet.of(BuildStatus.FAILURE, BuildStatus.ABORTED);

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, PARTIALLY_FAILED, FAILED, REJECTED, NO_BACKEND -> true;
            case PENDING, DISPATCHING, MONITORING -> false;
        };
    }

    /**
     * Aggregate of a set of terminal build statuses.
     *
     * COMPLETED when all are SUCCESS, FAILED when all are FAILURE or ABORTED,
     * PARTIALLY_FAILED otherwise (UNSTABLE counts as neither).
     */
    public static CompositeState fromStatuses(Collection<BuildStatus> statuses) {
        if (statuses.isEmpty()) {
            throw new IllegalArgumentException("No build statuses to aggregate");
        }
        if (statuses.stream().anyMatch(s -> !s.isTerminal())) {
            throw new IllegalArgumentException("Cannot aggregate non-terminal statuses: " + statuses);
        }
        if (statuses.stream().allMatch(s -> s == BuildStatus.SUCCESS)) {
            return COMPLETED;
        }
        if (statuses.stream().allMatch(FAILED_STATUSES::contains)) {
            return FAILED;
        }
        return PARTIALLY_FAILED;
    }
}
