package com.deploybot.orchestrator.api.dto;

import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildStatusEvent;

import java.time.Instant;

public record StatusEventResponse(BuildStatus from, BuildStatus to, String reason, Instant observedAt) {

    public static StatusEventResponse from(BuildStatusEvent e) {
        return new StatusEventResponse(e.getFromStatus(), e.getToStatus(), e.getReason(), e.getObservedAt());
    }
}
