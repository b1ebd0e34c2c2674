package com.deploybot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One deployment approval request: a project / environment / branch and the
 * services to release at given commit hashes.
 *
 * The request fields are fixed at creation (not updatable). Only the
 * approval decision, the composite state and the sync flag change
 * afterwards, and those only through compare-and-set updates in the store.
 *
 * DB table: workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflows")
public class WorkflowRequest {

    private static final DateTimeFormatter ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    @Id
    private String id;

    @Column(nullable = false, updatable = false)
    private String project;

    @Column(nullable = false, updatable = false)
    private String environment;

    @Column(nullable = false, updatable = false)
    private String branch;

    // Index-aligned (service, hash) pairs; position is the form order.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workflow_targets", joinColumns = @JoinColumn(name = "workflow_id"))
    @OrderColumn(name = "position")
    private List<ServiceTarget> targets = new ArrayList<>();

    @Column(name = "release_notes", columnDefinition = "TEXT", updatable = false)
    private String releaseNotes;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private String requesterId;

    @Column(name = "requester_name", updatable = false)
    private String requesterName;

    // Chat the request came from; every notification goes back here.
    @Column(name = "origin_chat_id", nullable = false, updatable = false)
    private String originChatId;

    // The approval prompt message, edited once the decision is taken.
    // Set at creation or attached once afterwards.
    @Column(name = "approval_message_id")
    private String approvalMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_state", nullable = false)
    private ApprovalState approvalState = ApprovalState.PENDING_APPROVAL;

    @Column(name = "decided_by")
    private String decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "composite_state", nullable = false)
    private CompositeState compositeState = CompositeState.PENDING;

    // Set once the decision has been pushed to the external API.
    @Column(nullable = false)
    private boolean synced = false;

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

    protected WorkflowRequest() {}   // required by JPA

    public WorkflowRequest(String project, String environment, String branch,
                           List<ServiceTarget> targets, String releaseNotes,
                           String requesterId, String requesterName,
                           String originChatId, String approvalMessageId) {
        this.id                = newId(createdAt);
        this.project           = project;
        this.environment       = environment;
        this.branch            = branch;
        this.targets           = new ArrayList<>(targets);
        this.releaseNotes      = releaseNotes;
        this.requesterId       = requesterId;
        this.requesterName     = requesterName;
        this.originChatId      = originChatId;
        this.approvalMessageId = approvalMessageId;
    }

    /** WF-yyyyMMddHHmmss-xxxxxx, sortable by creation time. */
    static String newId(Instant at) {
        int suffix = ThreadLocalRandom.current().nextInt(0x1000000);
        return "WF-" + ID_TIME.format(at) + "-" + String.format("%06x", suffix);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String         getId()                { return id; }
    public String         getProject()           { return project; }
    public String         getEnvironment()       { return environment; }
    public String         getBranch()            { return branch; }
    public List<ServiceTarget> getTargets()      { return Collections.unmodifiableList(targets); }
    public String         getReleaseNotes()      { return releaseNotes; }
    public String         getRequesterId()       { return requesterId; }
    public String         getRequesterName()     { return requesterName; }
    public String         getOriginChatId()      { return originChatId; }
    public String         getApprovalMessageId() { return approvalMessageId; }
    public ApprovalState  getApprovalState()     { return approvalState; }
    public String         getDecidedBy()         { return decidedBy; }
    public Instant        getDecidedAt()         { return decidedAt; }
    public CompositeState getCompositeState()    { return compositeState; }
    public boolean        isSynced()             { return synced; }
    public Instant        getCreatedAt()         { return createdAt; }
    public Instant        getUpdatedAt()         { return updatedAt; }

    // ------------------------------------------------------------------
    // Mutators used by store implementations after a successful
    // compare-and-set. Services never call these directly.
    // ------------------------------------------------------------------

    public void applyDecision(ApprovalState state, String actor, Instant at) {
        this.approvalState = state;
        this.decidedBy     = actor;
        this.decidedAt     = at;
        this.updatedAt     = at;
    }

    public void applyApprovalMessage(String messageId) {
        this.approvalMessageId = messageId;
    }

    public void applyCompositeState(CompositeState state) {
        this.compositeState = state;
        this.updatedAt      = Instant.now();
    }

    public void markSynced() {
        this.synced = true;
    }
}
