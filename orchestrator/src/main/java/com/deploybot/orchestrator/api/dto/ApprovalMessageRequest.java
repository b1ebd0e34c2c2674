package com.deploybot.orchestrator.api.dto;

public record ApprovalMessageRequest(String messageId) {}
