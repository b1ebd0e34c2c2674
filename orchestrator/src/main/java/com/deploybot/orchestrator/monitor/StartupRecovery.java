package com.deploybot.orchestrator.monitor;

import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.service.CompletionService;
import com.deploybot.orchestrator.service.DispatchService;
import com.deploybot.orchestrator.store.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds in-memory work from the store when the service starts.
 *
 * <ol>
 *   <li>Loads the configuration overrides.</li>
 *   <li>Re-registers every non-terminal submission with the monitor. Those
 *       builds are already running, so they occupy gate slots without
 *       waiting.</li>
 *   <li>Dispatches approved workflows that never left PENDING.</li>
 *   <li>Checks every MONITORING workflow for completion, which finishes
 *       workflows whose last build status was stored but whose completion
 *       check never ran.</li>
 *   <li>Moves workflows stuck in DISPATCHING to MONITORING and checks
 *       them for completion. Attempts that had not been recorded before
 *       the stop are not repeated.</li>
 * </ol>
 */
@Component
public class StartupRecovery implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    private final WorkflowStore     store;
    private final ProjectCatalog    catalog;
    private final AdmissionGate     gate;
    private final BuildMonitor      monitor;
    private final DispatchService   dispatcher;
    private final CompletionService completion;

    public StartupRecovery(WorkflowStore store,
                           ProjectCatalog catalog,
                           AdmissionGate gate,
                           BuildMonitor monitor,
                           DispatchService dispatcher,
                           CompletionService completion) {
        this.store      = store;
        this.catalog    = catalog;
        this.gate       = gate;
        this.monitor    = monitor;
        this.dispatcher = dispatcher;
        this.completion = completion;
    }

    @Override
    public void run(ApplicationArguments args) {
        catalog.reload();
        int resumed    = resumeMonitoring();
        int dispatched = resumeDispatch();
        int finished   = completeFinishedWorkflows();
        int promoted   = promoteInterruptedDispatches();
        log.info("Startup recovery: {} builds re-monitored, {} workflows dispatched, {} workflows finished, "
                + "{} dispatches closed", resumed, dispatched, finished, promoted);
    }

    int resumeMonitoring() {
        Map<String, Optional<WorkflowRequest>> workflows = new HashMap<>();
        int count = 0;
        for (BuildSubmission submission : store.listNonTerminalSubmissions()) {
            Optional<WorkflowRequest> wf = workflows.computeIfAbsent(submission.getWorkflowId(), store::findWorkflow);
            if (wf.isEmpty()) {
                log.warn("Submission {} belongs to missing workflow {}; skipped",
                        submission.getId(), submission.getWorkflowId());
                continue;
            }
            String project = wf.get().getProject();
            if (monitor.register(submission, project, gate.occupy(project, submission.getBackend()))) {
                count++;
            }
        }
        return count;
    }

    int resumeDispatch() {
        List<WorkflowRequest> pending = store.listWorkflows(ApprovalState.APPROVED, CompositeState.PENDING);
        for (WorkflowRequest wf : pending) {
            log.info("Resuming dispatch of approved workflow {}", wf.getId());
            dispatcher.dispatch(wf.getId()).whenComplete((report, error) -> {
                if (error != null) {
                    log.error("Recovered dispatch of workflow {} failed", wf.getId(), error);
                }
            });
        }
        return pending.size();
    }

    int completeFinishedWorkflows() {
        int count = 0;
        for (WorkflowRequest wf : store.listWorkflows(ApprovalState.APPROVED, CompositeState.MONITORING)) {
            if (completion.checkCompletion(wf.getId()).isPresent()) {
                log.info("Workflow {} had finished before the restart; completion recorded now", wf.getId());
                count++;
            }
        }
        return count;
    }

    int promoteInterruptedDispatches() {
        int count = 0;
        for (WorkflowRequest wf : store.listWorkflows(ApprovalState.APPROVED, CompositeState.DISPATCHING)) {
            if (store.compareAndSetComposite(wf.getId(), EnumSet.of(CompositeState.DISPATCHING), CompositeState.MONITORING)) {
                log.warn("Workflow {} was interrupted while dispatching; monitoring what was submitted", wf.getId());
                completion.checkCompletion(wf.getId());
                count++;
            }
        }
        return count;
    }
}
