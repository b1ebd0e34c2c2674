package com.deploybot.orchestrator.api.dto;

import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /workflows and GET /workflows/{id}.
 */
public record WorkflowResponse(
        String         id,
        String         project,
        String         environment,
        String         branch,
        List<Target>   targets,
        String         releaseNotes,
        String         requesterId,
        String         requesterName,
        String         originChatId,
        String         approvalMessageId,
        ApprovalState  approvalState,
        String         decidedBy,
        Instant        decidedAt,
        CompositeState compositeState,
        boolean        synced,
        Instant        createdAt,
        Instant        updatedAt
) {
    public record Target(String service, String commitHash) {
        static Target from(ServiceTarget t) {
            return new Target(t.getService(), t.getCommitHash());
        }
    }

    public static WorkflowResponse from(WorkflowRequest wf) {
        return new WorkflowResponse(
                wf.getId(),
                wf.getProject(),
                wf.getEnvironment(),
                wf.getBranch(),
                wf.getTargets().stream().map(Target::from).toList(),
                wf.getReleaseNotes(),
                wf.getRequesterId(),
                wf.getRequesterName(),
                wf.getOriginChatId(),
                wf.getApprovalMessageId(),
                wf.getApprovalState(),
                wf.getDecidedBy(),
                wf.getDecidedAt(),
                wf.getCompositeState(),
                wf.isSynced(),
                wf.getCreatedAt(),
                wf.getUpdatedAt()
        );
    }
}
