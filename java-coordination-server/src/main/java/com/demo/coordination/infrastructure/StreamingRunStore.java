package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.StreamingRun;

import java.util.List;
import java.util.Optional;

/**
 * Durable rows for in-flight runs and their final messages.
 */
public interface StreamingRunStore {

    StreamingRun create(StreamingRun run);

    Optional<StreamingRun> findById(String runId);

    /**
     * Runs of the pair still in INITIALIZING or STREAMING.
     */
    List<StreamingRun> findActive(String threadId, String responderId);

    /**
     * Create-or-update keyed by run id. Fails if the row exists but is no
     * longer active, which means another instance retired it.
     */
    void upsertContent(StreamingRun run, String content);

    /**
     * INITIALIZING to STREAMING.
     *
     * @return false if the run was not INITIALIZING
     */
    boolean markStreaming(String runId);

    /**
     * @return false if the run was already terminal
     */
    boolean markFailed(String runId, String reason);

    /**
     * Inserts the message and marks the run COMPLETE pointing at it, in one
     * transaction. Nothing is written if the run is no longer active.
     *
     * @return the stored message
     */
    Message complete(String runId, Message message);
}
