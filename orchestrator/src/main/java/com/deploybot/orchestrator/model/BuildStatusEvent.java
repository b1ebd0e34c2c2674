package com.deploybot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One persisted status change of a BuildSubmission (status history).
 *
 * DB table: build_status_history  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "build_status_history")
public class BuildStatusEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false)
    private UUID submissionId;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false)
    private BuildStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false)
    private BuildStatus toStatus;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    protected BuildStatusEvent() {}   // required by JPA

    public BuildStatusEvent(UUID submissionId, String workflowId, BuildStatus fromStatus,
                            BuildStatus toStatus, String reason, Instant observedAt) {
        this.submissionId = submissionId;
        this.workflowId   = workflowId;
        this.fromStatus   = fromStatus;
        this.toStatus     = toStatus;
        this.reason       = reason;
        this.observedAt   = observedAt;
    }

    public Long        getId()           { return id; }
    public UUID        getSubmissionId() { return submissionId; }
    public String      getWorkflowId()   { return workflowId; }
    public BuildStatus getFromStatus()   { return fromStatus; }
    public BuildStatus getToStatus()     { return toStatus; }
    public String      getReason()       { return reason; }
    public Instant     getObservedAt()   { return observedAt; }
}
