package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.notify.BuildNotifier;
import com.deploybot.orchestrator.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Moves a MONITORING workflow to its terminal composite state once every
 * submission is terminal.
 *
 * Called by the monitor after each terminal status and by the dispatcher
 * after the workflow enters MONITORING; several callers may race here. The
 * composite compare-and-set decides the winner, and only the winner sends
 * the completion message.
 */
@Service
public class CompletionService {

    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private final WorkflowStore store;
    private final BuildNotifier notifier;

    public CompletionService(WorkflowStore store, BuildNotifier notifier) {
        this.store    = store;
        this.notifier = notifier;
    }

    /**
     * @return the composite state this call moved the workflow to, or empty
     *         if the workflow is not ready or another caller got there first
     */
    public Optional<CompositeState> checkCompletion(String workflowId) {
        Optional<WorkflowRequest> found = store.findWorkflow(workflowId);
        if (found.isEmpty()) {
            log.warn("Completion check for unknown workflow {}", workflowId);
            return Optional.empty();
        }
        WorkflowRequest wf = found.get();
        if (wf.getCompositeState() != CompositeState.MONITORING) {
            return Optional.empty();
        }

        List<BuildSubmission> submissions = store.findSubmissions(workflowId);
        if (submissions.isEmpty()) {
            return Optional.empty();
        }
        List<BuildStatus> statuses = submissions.stream().map(BuildSubmission::getStatus).toList();
        if (statuses.stream().anyMatch(s -> !s.isTerminal())) {
            return Optional.empty();
        }

        CompositeState result = CompositeState.fromStatuses(statuses);
        if (!store.compareAndSetComposite(workflowId, EnumSet.of(CompositeState.MONITORING), result)) {
            log.debug("Workflow {} already completed by another caller", workflowId);
            return Optional.empty();
        }

        log.info("Workflow {} finished: {} ({} submissions)", workflowId, result, submissions.size());
        notifier.completed(wf, result, submissions);
        return Optional.of(result);
    }
}
