package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.StreamingRun;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.repository.StreamingRunRepository;
import com.demo.coordination.repository.ThreadMessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class JpaStreamingRunStore implements StreamingRunStore {

    private static final int MAX_REASON_LENGTH = 500;

    private final StreamingRunRepository runRepository;
    private final ThreadMessageRepository messageRepository;
    private final Clock clock;

    public JpaStreamingRunStore(StreamingRunRepository runRepository,
                                ThreadMessageRepository messageRepository,
                                Clock clock) {
        this.runRepository = runRepository;
        this.messageRepository = messageRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public StreamingRun create(StreamingRun run) {
        try {
            Instant now = clock.instant();
            run.setCreatedAt(now);
            run.setUpdatedAt(now);
            StreamingRun saved = runRepository.save(run);
            log.debug("Created streaming run: runId={}, threadId={}, responderId={}",
                    saved.getId(), saved.getThreadId(), saved.getResponderId());
            return saved;
        } catch (DataAccessException e) {
            log.error("Failed to create streaming run: runId={}", run.getId(), e);
            throw new StoreFailureException("Streaming run creation failed", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StreamingRun> findById(String runId) {
        try {
            return runRepository.findById(runId);
        } catch (DataAccessException e) {
            log.error("Failed to read streaming run: runId={}", runId, e);
            throw new StoreFailureException("Streaming run read failed", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<StreamingRun> findActive(String threadId, String responderId) {
        try {
            return runRepository.findByThreadIdAndResponderIdAndStateIn(
                    threadId, responderId, StreamingRun.ACTIVE_STATES);
        } catch (DataAccessException e) {
            log.error("Failed to list active runs: threadId={}, responderId={}", threadId, responderId, e);
            throw new StoreFailureException("Active run lookup failed", e);
        }
    }

    @Override
    @Transactional
    public void upsertContent(StreamingRun run, String content) {
        try {
            Instant now = clock.instant();
            int updated = runRepository.updateActiveContent(run.getId(), content, now, StreamingRun.ACTIVE_STATES);
            if (updated == 1) {
                return;
            }

            if (runRepository.existsById(run.getId())) {
                throw new StoreFailureException("Streaming run " + run.getId() + " is no longer active");
            }

            StreamingRun recreated = run.toBuilder()
                    .content(content)
                    .state(StreamingRun.RunState.STREAMING)
                    .createdAt(run.getCreatedAt() != null ? run.getCreatedAt() : now)
                    .updatedAt(now)
                    .build();
            runRepository.save(recreated);
            log.warn("Streaming run row was missing, recreated: runId={}", run.getId());

        } catch (DataAccessException e) {
            log.error("Failed to write run content: runId={}", run.getId(), e);
            throw new StoreFailureException("Streaming run content write failed", e);
        }
    }

    @Override
    @Transactional
    public boolean markStreaming(String runId) {
        try {
            return runRepository.transitionState(runId,
                    StreamingRun.RunState.INITIALIZING, StreamingRun.RunState.STREAMING, clock.instant()) == 1;
        } catch (DataAccessException e) {
            log.error("Failed to mark run streaming: runId={}", runId, e);
            throw new StoreFailureException("Streaming run state write failed", e);
        }
    }

    @Override
    @Transactional
    public boolean markFailed(String runId, String reason) {
        try {
            return runRepository.failActive(runId, truncate(reason), clock.instant(),
                    StreamingRun.RunState.FAILED, StreamingRun.ACTIVE_STATES) == 1;
        } catch (DataAccessException e) {
            log.error("Failed to mark run failed: runId={}", runId, e);
            throw new StoreFailureException("Streaming run state write failed", e);
        }
    }

    @Override
    @Transactional
    public Message complete(String runId, Message message) {
        try {
            Message saved = messageRepository.save(message);
            int updated = runRepository.completeActive(runId, saved.getContent(), saved.getId(), clock.instant(),
                    StreamingRun.RunState.COMPLETE, StreamingRun.ACTIVE_STATES);
            if (updated != 1) {
                // Rolls back the message insert
                throw new StoreFailureException("Streaming run " + runId + " is no longer active");
            }
            return saved;
        } catch (DataAccessException e) {
            log.error("Failed to complete run: runId={}", runId, e);
            throw new StoreFailureException("Streaming run completion failed", e);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
