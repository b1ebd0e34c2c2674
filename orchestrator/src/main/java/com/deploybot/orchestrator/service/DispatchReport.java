package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;

import java.util.List;

/**
 * Outcome of one dispatch.
 *
 * @param dispatched false when another caller had already dispatched the workflow
 * @param state      composite state right after dispatch
 */
public record DispatchReport(String workflowId, boolean dispatched, CompositeState state,
                             List<BuildSubmission> submissions) {

    public DispatchReport {
        submissions = List.copyOf(submissions);
    }

    static DispatchReport skipped(String workflowId, CompositeState current) {
        return new DispatchReport(workflowId, false, current, List.of());
    }

    public List<BuildSubmission> accepted() {
        return submissions.stream().filter(s -> !s.isSubmissionError()).toList();
    }

    public List<BuildSubmission> failed() {
        return submissions.stream().filter(BuildSubmission::isSubmissionError).toList();
    }
}
