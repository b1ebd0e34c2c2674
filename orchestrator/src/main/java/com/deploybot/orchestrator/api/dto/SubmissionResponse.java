package com.deploybot.orchestrator.api.dto;

import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a build submission returned by GET /workflows/{id}/submissions.
 * buildReference is null for submissions that never reached the backend.
 */
public record SubmissionResponse(
        UUID        id,
        BackendKind backend,
        String      service,
        String      commitHash,
        String      buildReference,
        BuildStatus status,
        String      failureReason,
        String      detailUrl,
        Instant     submittedAt,
        Instant     lastPolledAt,
        Instant     finishedAt
) {
    public static SubmissionResponse from(BuildSubmission s) {
        return new SubmissionResponse(
                s.getId(),
                s.getBackend(),
                s.getService(),
                s.getCommitHash(),
                s.getBuildReference(),
                s.getStatus(),
                s.getFailureReason(),
                s.getDetailUrl(),
                s.getSubmittedAt(),
                s.getLastPolledAt(),
                s.getFinishedAt()
        );
    }
}
