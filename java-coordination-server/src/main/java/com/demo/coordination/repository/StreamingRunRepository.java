package com.demo.coordination.repository;

import com.demo.coordination.domain.StreamingRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for StreamingRun persistence.
 *
 * Every state change is a conditional UPDATE guarded on the run still being
 * active, so a run reaches a terminal state at most once.
 */
@Repository
public interface StreamingRunRepository extends JpaRepository<StreamingRun, String> {

    List<StreamingRun> findByThreadIdAndResponderIdAndStateIn(
        String threadId,
        String responderId,
        Collection<StreamingRun.RunState> states
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StreamingRun r " +
           "SET r.content = :content, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.state IN :active")
    int updateActiveContent(
        @Param("id") String id,
        @Param("content") String content,
        @Param("now") Instant now,
        @Param("active") Collection<StreamingRun.RunState> active
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StreamingRun r " +
           "SET r.state = :next, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.state = :expected")
    int transitionState(
        @Param("id") String id,
        @Param("expected") StreamingRun.RunState expected,
        @Param("next") StreamingRun.RunState next,
        @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StreamingRun r " +
           "SET r.state = :failed, r.failureReason = :reason, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.state IN :active")
    int failActive(
        @Param("id") String id,
        @Param("reason") String reason,
        @Param("now") Instant now,
        @Param("failed") StreamingRun.RunState failed,
        @Param("active") Collection<StreamingRun.RunState> active
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StreamingRun r " +
           "SET r.state = :complete, r.content = :content, r.finalRecordId = :finalRecordId, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.state IN :active")
    int completeActive(
        @Param("id") String id,
        @Param("content") String content,
        @Param("finalRecordId") String finalRecordId,
        @Param("now") Instant now,
        @Param("complete") StreamingRun.RunState complete,
        @Param("active") Collection<StreamingRun.RunState> active
    );
}
