package com.deploybot.orchestrator.store;

import com.deploybot.orchestrator.model.*;
import com.deploybot.orchestrator.repository.BuildStatusEventRepository;
import com.deploybot.orchestrator.repository.BuildSubmissionRepository;
import com.deploybot.orchestrator.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * WorkflowStore backed by PostgreSQL through Spring Data JPA.
 *
 * The compare-and-set operations are single conditional UPDATE statements,
 * so the database row lock makes each of them atomic.
 */
@Component
public class JpaWorkflowStore implements WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(JpaWorkflowStore.class);

    private static final List<BuildStatus> NON_TERMINAL = Arrays.stream(BuildStatus.values())
            .filter(s -> !s.isTerminal())
            .toList();

    private final WorkflowRepository         workflowRepo;
    private final BuildSubmissionRepository  submissionRepo;
    private final BuildStatusEventRepository historyRepo;

    public JpaWorkflowStore(WorkflowRepository workflowRepo,
                            BuildSubmissionRepository submissionRepo,
                            BuildStatusEventRepository historyRepo) {
        this.workflowRepo   = workflowRepo;
        this.submissionRepo = submissionRepo;
        this.historyRepo    = historyRepo;
    }

    // ------------------------------------------------------------------
    // Workflows
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public WorkflowRequest createWorkflow(WorkflowRequest workflow) {
        return workflowRepo.save(workflow);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowRequest> findWorkflow(String workflowId) {
        return workflowRepo.findById(workflowId);
    }

    @Override
    @Transactional
    public boolean compareAndSetApproval(String workflowId, ApprovalState expected, ApprovalState next,
                                         String actor, Instant at) {
        return workflowRepo.compareAndSetApproval(workflowId, expected, next, actor, at) == 1;
    }

    @Override
    @Transactional
    public boolean compareAndSetComposite(String workflowId, Set<CompositeState> expected, CompositeState next) {
        boolean won = workflowRepo.compareAndSetComposite(workflowId, expected, next, Instant.now()) == 1;
        if (won) {
            log.debug("Workflow {} composite state → {}", workflowId, next);
        }
        return won;
    }

    @Override
    @Transactional
    public boolean attachApprovalMessage(String workflowId, String messageId) {
        return workflowRepo.attachApprovalMessage(workflowId, messageId, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public void markSynced(String workflowId) {
        workflowRepo.markSynced(workflowId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkflowRequest> listWorkflows(ApprovalState approvalState, CompositeState compositeState) {
        return workflowRepo.findByApprovalStateAndCompositeState(approvalState, compositeState);
    }

    // ------------------------------------------------------------------
    // Build submissions
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public BuildSubmission saveBuildSubmission(BuildSubmission submission) {
        return submissionRepo.save(submission);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BuildSubmission> findSubmission(UUID submissionId) {
        return submissionRepo.findById(submissionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BuildSubmission> findSubmissions(String workflowId) {
        return submissionRepo.findByWorkflowIdOrderByCreatedAtAsc(workflowId);
    }

    /**
     * The status row and its history row are written in one transaction:
     * either both exist or neither does.
     */
    @Override
    @Transactional
    public boolean updateBuildStatus(UUID submissionId, BuildStatus expected, BuildStatus next,
                                     String reason, String detailUrl) {
        Instant now = Instant.now();
        int rows = submissionRepo.compareAndSetStatus(submissionId, expected, next, reason, detailUrl,
                now, next.isTerminal() ? now : null);
        if (rows == 0) {
            return false;
        }
        String workflowId = submissionRepo.findById(submissionId)
                .map(BuildSubmission::getWorkflowId)
                .orElseThrow();
        historyRepo.save(new BuildStatusEvent(submissionId, workflowId, expected, next, reason, now));
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<BuildStatusEvent> statusHistory(UUID submissionId) {
        return historyRepo.findBySubmissionIdOrderByObservedAtAsc(submissionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BuildSubmission> listNonTerminalSubmissions() {
        return submissionRepo.findByStatusInOrderByCreatedAtAsc(NON_TERMINAL);
    }

    // ------------------------------------------------------------------
    // Retention
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public List<String> listExpired(Instant cutoff) {
        return workflowRepo.findIdsCreatedBefore(cutoff);
    }

    @Override
    @Transactional
    public void delete(String workflowId) {
        int history = historyRepo.deleteByWorkflowId(workflowId);
        int builds  = submissionRepo.deleteByWorkflowId(workflowId);
        workflowRepo.deleteById(workflowId);
        log.info("Deleted workflow {} ({} submissions, {} history rows)", workflowId, builds, history);
    }
}
