package com.deploybot.orchestrator.api.dto;

import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.service.DecisionOutcome;

import java.time.Instant;

public record DecisionResponse(String workflowId, ApprovalState approvalState, String decidedBy, Instant decidedAt) {

    public static DecisionResponse from(DecisionOutcome outcome) {
        return new DecisionResponse(outcome.workflowId(), outcome.state(), outcome.decidedBy(), outcome.decidedAt());
    }
}
