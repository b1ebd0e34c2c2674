package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.model.ActorRole;
import com.deploybot.orchestrator.model.ApprovalAction;
import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.notify.BuildNotifier;
import com.deploybot.orchestrator.store.WorkflowStore;
import com.deploybot.orchestrator.sync.DecisionSyncClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.concurrent.ExecutorService;

/**
 * Approval state machine: PENDING_APPROVAL -> APPROVED | REJECTED, once.
 *
 * The decision itself is a compare-and-set on the stored approval state, so
 * concurrent decisions on the same workflow produce exactly one winner; every
 * other caller gets ALREADY_DECIDED and causes no side effect.
 *
 * Everything that follows a decision (editing the approval message, the
 * rejection notice, dispatch, external sync) runs on the dispatch executor.
 * {@link #decide} returns as soon as the decision is stored.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final WorkflowStore      store;
    private final ApproverDirectory  directory;
    private final DispatchService    dispatcher;
    private final BuildNotifier      notifier;
    private final DecisionSyncClient sync;
    private final ExecutorService    executor;
    private final MeterRegistry      metrics;

    public ApprovalService(WorkflowStore store,
                           ApproverDirectory directory,
                           DispatchService dispatcher,
                           BuildNotifier notifier,
                           DecisionSyncClient sync,
                           @Qualifier("dispatchExecutor") ExecutorService executor,
                           MeterRegistry metrics) {
        this.store      = store;
        this.directory  = directory;
        this.dispatcher = dispatcher;
        this.notifier   = notifier;
        this.sync       = sync;
        this.executor   = executor;
        this.metrics    = metrics;
    }

    /**
     * Record a decision.
     *
     * @throws ApprovalException WORKFLOW_NOT_FOUND, UNAUTHORIZED_ACTOR or ALREADY_DECIDED
     */
    public DecisionOutcome decide(String workflowId, ApprovalAction action, String actor) {
        WorkflowRequest wf = store.findWorkflow(workflowId).orElseThrow(() ->
                new ApprovalException(ApprovalException.Kind.WORKFLOW_NOT_FOUND, "No workflow " + workflowId));

        if (!directory.isAuthorized(wf.getProject(), actor, ActorRole.APPROVER)
                && !directory.isAuthorized(wf.getProject(), actor, ActorRole.OPS)) {
            log.warn("{} tried to {} workflow {} without permission", actor, action, workflowId);
            throw new ApprovalException(ApprovalException.Kind.UNAUTHORIZED_ACTOR,
                    actor + " may not decide workflows of project " + wf.getProject());
        }

        ApprovalState next = action.targetState();
        Instant now = Instant.now();
        if (!store.compareAndSetApproval(workflowId, ApprovalState.PENDING_APPROVAL, next, actor, now)) {
            throw new ApprovalException(ApprovalException.Kind.ALREADY_DECIDED,
                    "Workflow " + workflowId + " was already decided");
        }

        metrics.counter("deploybot.decisions", "action", action.name()).increment();
        log.info("Workflow {} {} by {}", workflowId, next, actor);

        WorkflowRequest decided = store.findWorkflow(workflowId).orElse(wf);
        executor.execute(() -> afterDecision(decided, action, actor));
        return new DecisionOutcome(workflowId, next, actor, now);
    }

    private void afterDecision(WorkflowRequest wf, ApprovalAction action, String actor) {
        MDC.put("workflowId", wf.getId());
        try {
            try {
                notifier.decisionRecorded(wf, action, actor);
            } catch (RuntimeException e) {
                log.warn("Could not update the approval message of workflow {}", wf.getId(), e);
            }

            if (action == ApprovalAction.REJECT) {
                if (store.compareAndSetComposite(wf.getId(), EnumSet.of(CompositeState.PENDING), CompositeState.REJECTED)) {
                    notifier.rejected(wf, actor);
                }
            } else {
                startDispatch(wf);
            }

            if (sync.enabled()) {
                sync.sync(wf);
            }
        } catch (RuntimeException e) {
            log.error("Post-decision processing of workflow {} failed", wf.getId(), e);
        } finally {
            MDC.remove("workflowId");
        }
    }

    private void startDispatch(WorkflowRequest wf) {
        try {
            dispatcher.dispatch(wf.getId()).whenComplete((report, error) -> {
                if (error != null) {
                    log.error("Dispatch of workflow {} failed", wf.getId(), error);
                } else {
                    log.info("Dispatch of workflow {} done: {} ({} accepted, {} failed)", wf.getId(),
                            report.state(), report.accepted().size(), report.failed().size());
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not start dispatch of workflow {}", wf.getId(), e);
        }
    }
}
