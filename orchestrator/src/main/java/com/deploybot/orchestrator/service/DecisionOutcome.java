package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.model.ApprovalState;

import java.time.Instant;

/** What a successful decision recorded. Follow-up work is still running when this is returned. */
public record DecisionOutcome(String workflowId, ApprovalState state, String decidedBy, Instant decidedAt) {}
