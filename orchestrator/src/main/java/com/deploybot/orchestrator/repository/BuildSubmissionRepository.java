package com.deploybot.orchestrator.repository;

import com.deploybot.orchestrator.model.BuildStatus;
import com.deploybot.orchestrator.model.BuildSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + monitor queries for the build_submissions table.
 */
public interface BuildSubmissionRepository extends JpaRepository<BuildSubmission, UUID> {

    /** All submissions of a workflow, in dispatch order. */
    List<BuildSubmission> findByWorkflowIdOrderByCreatedAtAsc(String workflowId);

    /** Used at startup to rebuild the monitor's working set. */
    List<BuildSubmission> findByStatusInOrderByCreatedAtAsc(Collection<BuildStatus> statuses);

    /**
     * Write-through of a newly observed status.
     *
     * The WHERE clause on the previous status makes the update a
     * compare-and-set: a stale monitor (e.g. a duplicate after a restart)
     * gets 0 rows back and must stop without notifying.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE BuildSubmission s
               SET s.status = :next,
                   s.failureReason = COALESCE(:reason, s.failureReason),
                   s.detailUrl = COALESCE(:url, s.detailUrl),
                   s.lastPolledAt = :at,
                   s.finishedAt = :finishedAt,
                   s.updatedAt = :at
             WHERE s.id = :id AND s.status = :expected
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") BuildStatus expected,
                            @Param("next") BuildStatus next,
                            @Param("reason") String reason,
                            @Param("url") String url,
                            @Param("at") Instant at,
                            @Param("finishedAt") Instant finishedAt);

    @Modifying
    @Query("DELETE FROM BuildSubmission s WHERE s.workflowId = :workflowId")
    int deleteByWorkflowId(@Param("workflowId") String workflowId);
}
