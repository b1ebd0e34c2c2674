package com.deploybot.orchestrator.api.dto;

import com.deploybot.orchestrator.service.WorkflowDraft;

import java.util.List;

/**
 * Request body for POST /workflows.
 *
 * Required: project, environment, services, hashes (same length, same order),
 *   requesterId, originChatId
 * Optional: branch, releaseNotes, requesterName, approvalMessageId (can also
 *   be attached later with PUT /workflows/{id}/approval-message)
 */
public record CreateWorkflowRequest(
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
    public WorkflowDraft toDraft() {
        return new WorkflowDraft(project, environment, branch, services, hashes, releaseNotes,
                requesterId, requesterName, originChatId, approvalMessageId);
    }
}
