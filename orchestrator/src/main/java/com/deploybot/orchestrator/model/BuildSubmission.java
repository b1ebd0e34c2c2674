package com.deploybot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * The dispatch of one service of a workflow to one backend.
 *
 * Identity is (workflow_id, backend, service); the UUID is a surrogate key.
 * The backend owns the authoritative build status, this row caches the last
 * value the monitor observed.
 *
 * A submission attempt that the backend refused is stored too, with status
 * FAILURE and no build reference, so the per-service breakdown is complete.
 *
 * DB table: build_submissions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "build_submissions",
       uniqueConstraints = @UniqueConstraint(columnNames = {"workflow_id", "backend", "service"}))
public class BuildSubmission {

    public static final String SUBMISSION_ERROR = "SubmissionError";
    public static final String MONITOR_TIMEOUT  = "MonitorTimeout";

    @Id
    private UUID id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private String workflowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private BackendKind backend;

    @Column(nullable = false, updatable = false)
    private String service;

    @Column(name = "commit_hash", nullable = false, updatable = false)
    private String commitHash;

    // Opaque backend handle: "<job path>#<build number>" for Jenkins,
    // the process instance id for SSO. Null when the submission failed.
    @Column(name = "build_reference", updatable = false)
    private String buildReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BuildStatus status = BuildStatus.SUBMITTED;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "detail_url")
    private String detailUrl;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt = Instant.now();

    @Column(name = "last_polled_at")
    private Instant lastPolledAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected BuildSubmission() {}   // required by JPA

    private BuildSubmission(String workflowId, BackendKind backend, String service,
                            String commitHash, String buildReference) {
        this.id             = UUID.randomUUID();
        this.workflowId     = workflowId;
        this.backend        = backend;
        this.service        = service;
        this.commitHash     = commitHash;
        this.buildReference = buildReference;
    }

    /** A build the backend accepted, waiting for its first poll. */
    public static BuildSubmission submitted(String workflowId, BackendKind backend, String service,
                                            String commitHash, String buildReference) {
        return new BuildSubmission(workflowId, backend, service, commitHash, buildReference);
    }

    /** A submission attempt that never reached the backend's build queue. */
    public static BuildSubmission rejected(String workflowId, BackendKind backend, String service,
                                           String commitHash, String error) {
        BuildSubmission s = new BuildSubmission(workflowId, backend, service, commitHash, null);
        s.status        = BuildStatus.FAILURE;
        s.failureReason = SUBMISSION_ERROR + ": " + error;
        s.finishedAt    = s.submittedAt;
        return s;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID        getId()             { return id; }
    public String      getWorkflowId()     { return workflowId; }
    public BackendKind getBackend()        { return backend; }
    public String      getService()        { return service; }
    public String      getCommitHash()     { return commitHash; }
    public String      getBuildReference() { return buildReference; }
    public BuildStatus getStatus()         { return status; }
    public String      getFailureReason()  { return failureReason; }
    public String      getDetailUrl()      { return detailUrl; }
    public Instant     getSubmittedAt()    { return submittedAt; }
    public Instant     getLastPolledAt()   { return lastPolledAt; }
    public Instant     getFinishedAt()     { return finishedAt; }
    public Instant     getCreatedAt()      { return createdAt; }
    public Instant     getUpdatedAt()      { return updatedAt; }

    public boolean isTimedOut() {
        return failureReason != null && failureReason.startsWith(MONITOR_TIMEOUT);
    }

    public boolean isSubmissionError() {
        return buildReference == null && failureReason != null
                && failureReason.startsWith(SUBMISSION_ERROR);
    }

    /** Applied by store implementations after a successful status compare-and-set. */
    public void applyStatus(BuildStatus next, String reason, String url, Instant at) {
        this.status       = next;
        this.lastPolledAt = at;
        this.updatedAt    = at;
        if (reason != null) this.failureReason = reason;
        if (url != null)    this.detailUrl     = url;
        if (next.isTerminal()) this.finishedAt = at;
    }
}
