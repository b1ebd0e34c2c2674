package com.deploybot.orchestrator.repository;

import com.deploybot.orchestrator.model.ApprovalState;
import com.deploybot.orchestrator.model.CompositeState;
import com.deploybot.orchestrator.model.WorkflowRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * CRUD + compare-and-set operations for the workflows table.
 *
 * The conditional UPDATEs below are the concurrency guards of the engine:
 * each returns the number of rows changed, so 0 means another writer got
 * there first and the caller must not act on the state it read earlier.
 */
public interface WorkflowRepository extends JpaRepository<WorkflowRequest, String> {

    /** Approval decision; succeeds only while the row is still in {@code expected}. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkflowRequest w
               SET w.approvalState = :next, w.decidedBy = :actor,
                   w.decidedAt = :at, w.updatedAt = :at
             WHERE w.id = :id AND w.approvalState = :expected
            """)
    int compareAndSetApproval(@Param("id") String id,
                              @Param("expected") ApprovalState expected,
                              @Param("next") ApprovalState next,
                              @Param("actor") String actor,
                              @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkflowRequest w
               SET w.compositeState = :next, w.updatedAt = :at
             WHERE w.id = :id AND w.compositeState IN :expected
            """)
    int compareAndSetComposite(@Param("id") String id,
                               @Param("expected") Collection<CompositeState> expected,
                               @Param("next") CompositeState next,
                               @Param("at") Instant at);

    /** Attaches the approval prompt message id; only the first attach wins. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkflowRequest w
               SET w.approvalMessageId = :messageId, w.updatedAt = :at
             WHERE w.id = :id AND w.approvalMessageId IS NULL
            """)
    int attachApprovalMessage(@Param("id") String id,
                              @Param("messageId") String messageId,
                              @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE WorkflowRequest w SET w.synced = true WHERE w.id = :id")
    int markSynced(@Param("id") String id);

    List<WorkflowRequest> findByApprovalStateAndCompositeState(ApprovalState approvalState,
                                                               CompositeState compositeState);

    /** Ids of workflows created before the retention cutoff. */
    @Query("SELECT w.id FROM WorkflowRequest w WHERE w.createdAt < :cutoff ORDER BY w.createdAt ASC")
    List<String> findIdsCreatedBefore(@Param("cutoff") Instant cutoff);
}
