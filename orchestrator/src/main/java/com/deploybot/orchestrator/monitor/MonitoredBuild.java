package com.deploybot.orchestrator.monitor;

import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;

import java.time.Instant;
import java.util.UUID;

/**
 * Monitor-side state of one submission.
 *
 * Poll cycles of one build run one after the other (each schedules the
 * following one), so the mutable fields are only touched by one thread at a time;
 * they are volatile because that thread changes between cycles.
 */
final class MonitoredBuild {

    final UUID        submissionId;
    final String      workflowId;
    final String      project;
    final BackendKind backend;
    final String      service;
    final String      reference;
    final Instant     startedAt;
    final AdmissionGate.Permit permit;

    volatile BuildStatus lastStatus;
    volatile int         cycles;

    MonitoredBuild(BuildSubmission submission, String project, AdmissionGate.Permit permit) {
        this.submissionId = submission.getId();
        this.workflowId   = submission.getWorkflowId();
        this.project      = project;
        this.backend      = submission.getBackend();
        this.service      = submission.getService();
        this.reference    = submission.getBuildReference();
        this.startedAt    = submission.getSubmittedAt();
        this.permit       = permit;
        this.lastStatus   = submission.getStatus();
    }

    @Override
    public String toString() {
        return backend + "/" + service + " [" + reference + "] of " + workflowId;
    }
}
