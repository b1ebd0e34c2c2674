package com.deploybot.orchestrator.monitor;

import com.deploybot.orchestrator.backend.BackendClient;
import com.deploybot.orchestrator.backend.BackendException;
import com.deploybot.orchestrator.backend.BackendRegistry;
import com.deploybot.orchestrator.backend.BuildObservation;
import com.deploybot.orchestrator.config.DeployProperties;
import com.deploybot.orchestrator.config.ProjectCatalog;
import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import com.deploybot.orchestrator.service.CompletionService;
import com.deploybot.orchestrator.store.WorkflowStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls every accepted submission until it reaches a terminal status.
 *
 * Each submission gets its own chain of scheduled tasks: one poll cycle,
 * then the next cycle {@code poll-interval} later. Within a cycle a
 * transient backend failure is retried after
 * {@code poll-retry-backoff * 2^(attempt-1)}, up to
 * {@code poll-retry-attempts}; a cycle that still fails is logged and the
 * chain carries on with the next regular tick.
 *
 * A changed status is written to the store (compare-and-set on the last
 * observed status) before anything else. Losing that compare-and-set means
 * another writer moved the row; if the row is terminal the local task is
 * dropped silently.
 *
 * On a terminal status the admission permit is released and the workflow
 * gets a completion check.
 */
@Component
public class BuildMonitor {

    private static final Logger log = LoggerFactory.getLogger(BuildMonitor.class);

    private final WorkflowStore            store;
    private final BackendRegistry          backends;
    private final ProjectCatalog           catalog;
    private final CompletionService        completion;
    private final ScheduledExecutorService scheduler;
    private final DeployProperties.Monitor settings;
    private final MeterRegistry            metrics;

    private final Map<UUID, MonitoredBuild> active = new ConcurrentHashMap<>();

    public BuildMonitor(WorkflowStore store,
                        BackendRegistry backends,
                        ProjectCatalog catalog,
                        CompletionService completion,
                        @Qualifier("monitorScheduler") ScheduledExecutorService scheduler,
                        DeployProperties properties,
                        MeterRegistry metrics) {
        this.store      = store;
        this.backends   = backends;
        this.catalog    = catalog;
        this.completion = completion;
        this.scheduler  = scheduler;
        this.settings   = properties.monitor();
        this.metrics    = metrics;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Start monitoring a submission. Idempotent per submission id: a second
     * registration releases its permit and returns false.
     */
    public boolean register(BuildSubmission submission, String project, AdmissionGate.Permit permit) {
        if (submission.getStatus().isTerminal() || submission.getBuildReference() == null) {
            permit.release();
            log.debug("Not monitoring {} / {}: status {}", submission.getBackend(), submission.getService(),
                    submission.getStatus());
            return false;
        }

        MonitoredBuild build = new MonitoredBuild(submission, project, permit);
        if (active.putIfAbsent(build.submissionId, build) != null) {
            permit.release();
            log.debug("Submission {} is already monitored", build.submissionId);
            return false;
        }

        log.info("Monitoring {} (every {})", build, settings.pollInterval());
        schedule(build, 1, settings.pollInterval());
        return true;
    }

    public boolean isMonitoring(UUID submissionId) {
        return active.containsKey(submissionId);
    }

    public int activeCount() {
        return active.size();
    }

    // ------------------------------------------------------------------
    // Poll cycle
    // ------------------------------------------------------------------

    private void schedule(MonitoredBuild build, int attempt, Duration delay) {
        if (active.get(build.submissionId) != build) {
            return;
        }
        try {
            scheduler.schedule(() -> runAttempt(build, attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // Shutting down; StartupRecovery picks the build up on the next start.
            log.warn("Monitor scheduler rejected {}; monitoring stops", build);
            active.remove(build.submissionId, build);
        }
    }

    private void runAttempt(MonitoredBuild build, int attempt) {
        if (active.get(build.submissionId) != build) {
            return;
        }
        MDC.put("workflowId", build.workflowId);
        MDC.put("backend", build.backend.name());
        MDC.put("service", build.service);
        try {
            if (attempt == 1 && timedOut(build)) {
                schedule(build, 1, settings.pollInterval());
                return;
            }
            BuildObservation observation = poll(build);
            count(build, "ok");
            onObservation(build, observation);
            schedule(build, 1, settings.pollInterval());
        } catch (BackendException e) {
            count(build, "error");
            if (attempt < settings.pollRetryAttempts()) {
                Duration backoff = settings.pollRetryBackoff().multipliedBy(1L << (attempt - 1));
                log.debug("Poll of {} failed (attempt {}/{}), retrying in {}: {}",
                        build, attempt, settings.pollRetryAttempts(), backoff, e.getMessage());
                schedule(build, attempt + 1, backoff);
            } else {
                log.warn("Poll of {} failed after {} attempts: {}", build, attempt, e.getMessage());
                schedule(build, 1, settings.pollInterval());
            }
        } catch (RuntimeException e) {
            count(build, "error");
            log.error("Poll cycle of {} failed", build, e);
            schedule(build, 1, settings.pollInterval());
        } finally {
            MDC.remove("workflowId");
            MDC.remove("backend");
            MDC.remove("service");
        }
    }

    private BuildObservation poll(MonitoredBuild build) {
        BackendClient client = backends.get(build.backend);
        return client.pollStatus(build.reference, catalog.get(build.project));
    }

    /** Counts the cycle; aborts the build once max-polls or max-duration is exceeded. */
    private boolean timedOut(MonitoredBuild build) {
        build.cycles++;
        Duration elapsed = Duration.between(build.startedAt, Instant.now());
        boolean tooManyPolls = build.cycles > settings.maxPolls();
        boolean tooLong      = elapsed.compareTo(settings.maxDuration()) > 0;
        if (!tooManyPolls && !tooLong) {
            return false;
        }
        String reason = BuildSubmission.MONITOR_TIMEOUT + ": no terminal status after "
                + (build.cycles - 1) + " polls / " + elapsed.toSeconds() + "s";
        log.warn("{} timed out in {}: {}", build, build.lastStatus, reason);
        writeThrough(build, BuildStatus.ABORTED, reason, null);
        return true;
    }

    private void onObservation(MonitoredBuild build, BuildObservation observation) {
        BuildStatus next = observation.status();
        if (next == build.lastStatus) {
            return;
        }
        if (!build.lastStatus.canTransitionTo(next)) {
            log.warn("Ignoring {} -> {} for {}", build.lastStatus, next, build);
            return;
        }
        writeThrough(build, next, null, observation.detailUrl());
    }

    private void writeThrough(MonitoredBuild build, BuildStatus next, String reason, String detailUrl) {
        BuildStatus expected = build.lastStatus;
        if (!store.updateBuildStatus(build.submissionId, expected, next, reason, detailUrl)) {
            Optional<BuildSubmission> current = store.findSubmission(build.submissionId);
            if (current.isEmpty() || current.get().getStatus().isTerminal()) {
                log.info("{} was finished elsewhere; dropping local task", build);
                stop(build);
            } else {
                build.lastStatus = current.get().getStatus();
            }
            return;
        }

        log.info("{}: {} -> {}", build, expected, next);
        build.lastStatus = next;
        if (next.isTerminal()) {
            metrics.counter("deploybot.monitor.builds",
                    "backend", build.backend.name(), "status", next.name()).increment();
            stop(build);
            checkCompletion(build.workflowId, 1);
        }
    }

    /**
     * The terminal status is already stored, so a failed check is retried
     * every {@code poll-interval} up to {@code poll-retry-attempts} times.
     * After that StartupRecovery finishes the workflow on the next start.
     */
    private void checkCompletion(String workflowId, int attempt) {
        try {
            completion.checkCompletion(workflowId);
        } catch (RuntimeException e) {
            if (attempt >= settings.pollRetryAttempts()) {
                log.error("Completion check of workflow {} failed {} times; left for startup recovery",
                        workflowId, attempt, e);
                return;
            }
            log.warn("Completion check of workflow {} failed (attempt {}), retrying in {}",
                    workflowId, attempt, settings.pollInterval(), e);
            try {
                scheduler.schedule(() -> checkCompletion(workflowId, attempt + 1),
                        settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                log.warn("Monitor scheduler rejected the completion check of workflow {}", workflowId);
            }
        }
    }

    private void stop(MonitoredBuild build) {
        if (active.remove(build.submissionId, build)) {
            build.permit.release();
        }
    }

    private void count(MonitoredBuild build, String outcome) {
        metrics.counter("deploybot.monitor.polls", "backend", build.backend.name(), "outcome", outcome).increment();
    }
}
