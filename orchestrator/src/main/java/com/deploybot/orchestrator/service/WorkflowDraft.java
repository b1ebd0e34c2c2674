package com.deploybot.orchestrator.service;

import java.util.List;

/**
 * A deployment request as the front end submits it. Services and hashes
 * are parallel lists; WorkflowService validates and pairs them.
 */
public record WorkflowDraft(
        String       project,
        String       environment,
        String       branch,
        List<String> services,
        List<String> hashes,
        String       releaseNotes,
        String       requesterId,
        String       requesterName,
        String       originChatId,
        String       approvalMessageId
) {
    public WorkflowDraft {
        services = services == null ? List.of() : List.copyOf(services);
        hashes   = hashes == null ? List.of() : List.copyOf(hashes);
    }
}
