package com.deploybot.orchestrator.service;

import com.deploybot.orchestrator.backend.BackendClient;
import com.deploybot.orchestrator.backend.BackendException;
import com.deploybot.orchestrator.backend.BackendRegistry;
import com.deploybot.orchestrator.backend.BuildRequest;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.config.ProjectSettings;
import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.BackendKind;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.ServiceTarget;
import com.deploybot.orchestrator.model.WorkflowRequest;
import com.deploybot.orchestrator.monitor.AdmissionGate;
import com.deploybot.orchestrator.monitor.BuildMonitor;
import com.deploybot.orchestrator.notify.BuildNotifier;
import com.deploybot.orchestrator.store.WorkflowStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Turns an approved workflow into build submissions.
 *
 * One attempt per (enabled backend, service). Every attempt first waits
 * for an admission slot of its backend, then submits; attempts never wait
 * on each other. A TRANSIENT failure is retried once after
 * {@code submit-retry-backoff}, a REJECTED one is not retried.
 *
 * Accepted submissions are persisted as SUBMITTED and handed to the monitor
 * together with their permit. Failed ones release the permit and are
 * persisted as FAILURE with a SubmissionError reason.
 *
 * The PENDING -> DISPATCHING compare-and-set at the start guarantees that
 * a workflow is dispatched at most once.
 */
@Service
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final WorkflowStore     store;
    private final ProjectCatalog    catalog;
    private final BackendRegistry   backends;
    private final AdmissionGate     gate;
    private final BuildMonitor      monitor;
    private final CompletionService completion;
    private final BuildNotifier     notifier;
    private final ExecutorService   executor;
    private final Duration          retryBackoff;
    private final MeterRegistry     metrics;

    public DispatchService(WorkflowStore store,
                           ProjectCatalog catalog,
                           BackendRegistry backends,
                           AdmissionGate gate,
                           BuildMonitor monitor,
                           CompletionService completion,
                           BuildNotifier notifier,
                           @Qualifier("dispatchExecutor") ExecutorService executor,
                           DeployProperties properties,
                           MeterRegistry metrics) {
        this.store        = store;
        this.catalog      = catalog;
        this.backends     = backends;
        this.gate         = gate;
        this.monitor      = monitor;
        this.completion   = completion;
        this.notifier     = notifier;
        this.executor     = executor;
        this.retryBackoff = properties.dispatch().submitRetryBackoff();
        this.metrics      = metrics;
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Start dispatching an approved workflow.
     *
     * Returns at once; the future completes when every attempt has an
     * outcome and the workflow has left DISPATCHING.
     *
     * @throws WorkflowNotFoundException if the workflow does not exist
     * @throws IllegalStateException     if the workflow is not approved
     */
    public CompletableFuture<DispatchReport> dispatch(String workflowId) {
        WorkflowRequest wf = store.findWorkflow(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        if (wf.getApprovalState() != ApprovalState.APPROVED) {
            throw new IllegalStateException("Workflow " + workflowId + " is " + wf.getApprovalState());
        }
        if (!store.compareAndSetComposite(workflowId, EnumSet.of(CompositeState.PENDING), CompositeState.DISPATCHING)) {
            log.info("Workflow {} already dispatched (state {})", workflowId, wf.getCompositeState());
            return CompletableFuture.completedFuture(DispatchReport.skipped(workflowId, wf.getCompositeState()));
        }

        ProjectSettings project = catalog.get(wf.getProject());
        List<BackendKind> kinds = project.enabledBackends();
        if (kinds.isEmpty()) {
            log.warn("Workflow {}: project {} has no enabled backend", workflowId, wf.getProject());
            store.compareAndSetComposite(workflowId, EnumSet.of(CompositeState.DISPATCHING), CompositeState.NO_BACKEND);
            notifier.noBackend(wf);
            return CompletableFuture.completedFuture(
                    new DispatchReport(workflowId, true, CompositeState.NO_BACKEND, List.of()));
        }

        log.info("Dispatching workflow {} to {} for {} service(s)", workflowId, kinds, wf.getTargets().size());
        List<CompletableFuture<BuildSubmission>> attempts = new ArrayList<>();
        for (BackendKind kind : kinds) {
            for (ServiceTarget target : wf.getTargets()) {
                attempts.add(attempt(wf, kind, target));
            }
        }

        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0]))
                .handleAsync((ignored, error) -> finish(wf, attempts), executor);
    }

    /** Wait for a slot, then submit with at most one retry, then record the outcome. */
    private CompletableFuture<BuildSubmission> attempt(WorkflowRequest wf, BackendKind kind, ServiceTarget target) {
        return gate.admit(wf.getProject(), kind)
                .thenComposeAsync(permit -> submitWithRetry(wf, kind, target)
                        .handle((reference, error) -> record(wf, kind, target, permit, reference, error)), executor);
    }

    private CompletableFuture<String> submitWithRetry(WorkflowRequest wf, BackendKind kind, ServiceTarget target) {
        return CompletableFuture.supplyAsync(() -> submitOnce(wf, kind, target), executor)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof BackendException be && be.isTransient()) {
                        log.warn("Submission of {} / {} for {} failed, retrying in {}: {}",
                                kind, target.getService(), wf.getId(), retryBackoff, be.getMessage());
                        count(kind, "retried");
                        return CompletableFuture.supplyAsync(() -> submitOnce(wf, kind, target),
                                CompletableFuture.delayedExecutor(retryBackoff.toMillis(), TimeUnit.MILLISECONDS, executor));
                    }
                    return CompletableFuture.failedFuture(cause);
                });
    }

    private String submitOnce(WorkflowRequest wf, BackendKind kind, ServiceTarget target) {
        putMdc(wf, kind, target);
        try {
            BackendClient client = backends.get(kind);
            BuildRequest request = new BuildRequest(wf.getId(), wf.getProject(), wf.getEnvironment(),
                    wf.getBranch(), target.getService(), target.getCommitHash(), wf.getDecidedBy(),
                    wf.getReleaseNotes());
            return client.submit(request, catalog.get(wf.getProject()));
        } finally {
            clearMdc();
        }
    }

    /** Runs on a dispatch thread; persists one outcome and hands accepted builds to the monitor. */
    private BuildSubmission record(WorkflowRequest wf, BackendKind kind, ServiceTarget target,
                                   AdmissionGate.Permit permit, String reference, Throwable error) {
        putMdc(wf, kind, target);
        try {
            if (error != null) {
                permit.release();
                Throwable cause = unwrap(error);
                String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                log.error("Submission of {} / {} for {} failed: {}", kind, target.getService(), wf.getId(), message);
                count(kind, "failed");
                return store.saveBuildSubmission(BuildSubmission.rejected(
                        wf.getId(), kind, target.getService(), target.getCommitHash(), message));
            }

            BuildSubmission saved;
            try {
                saved = store.saveBuildSubmission(BuildSubmission.submitted(
                        wf.getId(), kind, target.getService(), target.getCommitHash(), reference));
            } catch (RuntimeException e) {
                permit.release();
                throw e;
            }
            count(kind, "accepted");
            log.info("Submitted {} / {} for {} as {}", kind, target.getService(), wf.getId(), reference);
            monitor.register(saved, wf.getProject(), permit);
            return saved;
        } finally {
            clearMdc();
        }
    }

    private DispatchReport finish(WorkflowRequest wf, List<CompletableFuture<BuildSubmission>> attempts) {
        List<BuildSubmission> submissions = attempts.stream()
                .map(f -> f.exceptionally(e -> {
                    log.error("Could not record a submission of workflow {}", wf.getId(), unwrap(e));
                    return null;
                }).join())
                .filter(Objects::nonNull)
                .toList();

        if (submissions.stream().allMatch(BuildSubmission::isSubmissionError)) {
            log.error("Workflow {}: every submission failed", wf.getId());
            store.compareAndSetComposite(wf.getId(), EnumSet.of(CompositeState.DISPATCHING), CompositeState.FAILED);
            notifier.dispatchFailed(wf, submissions);
            return new DispatchReport(wf.getId(), true, CompositeState.FAILED, submissions);
        }

        notifier.submissionResult(wf, submissions);
        store.compareAndSetComposite(wf.getId(), EnumSet.of(CompositeState.DISPATCHING), CompositeState.MONITORING);
        // Builds may all have finished while the others were still being submitted.
        CompositeState state = completion.checkCompletion(wf.getId()).orElse(CompositeState.MONITORING);
        return new DispatchReport(wf.getId(), true, state, submissions);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private void count(BackendKind kind, String outcome) {
        metrics.counter("deploybot.dispatch.submissions", "backend", kind.name(), "outcome", outcome).increment();
    }

    private static void putMdc(WorkflowRequest wf, BackendKind kind, ServiceTarget target) {
        MDC.put("workflowId", wf.getId());
        MDC.put("backend", kind.name());
        MDC.put("service", target.getService());
    }

    private static void clearMdc() {
        MDC.remove("workflowId");
        MDC.remove("backend");
        MDC.remove("service");
    }
}
