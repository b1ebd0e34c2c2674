package com.deploybot.orchestrator.backend;

import com.deploybot.orchestrator.model.BuildStatus;

/**
 * Result of one status poll.
 *
 * @param detailUrl  link to the build page, when the backend reports one
 * @param durationMs build duration reported by the backend, 0 if unknown
 */
public record BuildObservation(BuildStatus status, String detailUrl, long durationMs) {

    public static BuildObservation of(BuildStatus status) {
        return new BuildObservation(status, null, 0);
    }
}
