package com.deploybot.orchestrator.backend;

/**
 * What every backend receives for one (service, hash) of an approved workflow.
 * The approver is passed on as an audit parameter.
 */
public record BuildRequest(
        String workflowId,
        String project,
        String environment,
        String branch,
        String service,
        String commitHash,
        String approver,
        String releaseNotes
) {}
