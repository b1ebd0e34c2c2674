package com.deploybot.orchestrator.api.dto;

/** Request body for POST /workflows/{id}/decision. action is "approve" or "reject". */
public record DecisionRequest(String action, String actor) {}
