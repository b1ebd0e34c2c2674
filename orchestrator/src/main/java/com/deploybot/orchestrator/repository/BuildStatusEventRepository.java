package com.deploybot.orchestrator.repository;

import com.deploybot.orchestrator.model.BuildStatusEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

/**
 * Status history rows, appended on every write-through.
 */
public interface BuildStatusEventRepository extends JpaRepository<BuildStatusEvent, Long> {

    List<BuildStatusEvent> findBySubmissionIdOrderByObservedAtAsc(UUID submissionId);

    @Modifying
    @Query("DELETE FROM BuildStatusEvent e WHERE e.workflowId = :workflowId")
    int deleteByWorkflowId(@Param("workflowId") String workflowId);
}
