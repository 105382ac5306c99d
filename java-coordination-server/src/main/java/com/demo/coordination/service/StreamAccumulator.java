package com.demo.coordination.service;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.StreamingRun;
import com.demo.coordination.exception.NotFoundException;
import com.demo.coordination.infrastructure.RedisPubSubPublisher;
import com.demo.coordination.infrastructure.StreamingRunStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stream Accumulator
 *
 * Buffers text increments of a run and writes the accumulated content to the
 * run row in batches. Each durable write is followed by a change
 * notification on the thread's run channel.
 *
 * Increments of one run arrive sequentially from its orchestration thread;
 * different runs have independent buffers.
 */
@Service
@Slf4j
public class StreamAccumulator {

    private final StreamingRunStore runStore;
    private final RedisPubSubPublisher pubSubPublisher;
    private final CoordinationProperties properties;
    private final Clock clock;

    private final Map<String, RunBuffer> buffers;

    public StreamAccumulator(
            StreamingRunStore runStore,
            RedisPubSubPublisher pubSubPublisher,
            CoordinationProperties properties,
            Clock clock) {
        this.runStore = runStore;
        this.pubSubPublisher = pubSubPublisher;
        this.properties = properties;
        this.clock = clock;
        this.buffers = new ConcurrentHashMap<>();
    }

    /**
     * Start buffering for a run that has already been created in the store.
     */
    public void open(StreamingRun run) {
        buffers.put(run.getId(), new RunBuffer(run));
        log.debug("Accumulator opened: runId={}, threadId={}", run.getId(), run.getThreadId());
    }

    /**
     * Appends an increment and flushes when the unflushed part reaches the
     * configured threshold.
     *
     * @return total accumulated length
     */
    public int append(String runId, String delta) {
        RunBuffer buffer = requireBuffer(runId);
        if (delta == null || delta.isEmpty()) {
            return buffer.content.length();
        }

        buffer.content.append(delta);
        buffer.unflushed += delta.length();

        if (buffer.unflushed >= properties.getStream().getFlushThreshold()) {
            flush(buffer);
        }
        return buffer.content.length();
    }

    /**
     * Accumulated content of an open run.
     */
    String contentOf(String runId) {
        return requireBuffer(runId).content.toString();
    }

    /**
     * Writes the permanent message and marks the run COMPLETE in one store
     * transaction. {@code content} replaces whatever was accumulated.
     *
     * @return id of the stored message
     */
    public String finalizeRun(String runId, String content) {
        RunBuffer buffer = requireBuffer(runId);
        StreamingRun run = buffer.run;

        // Last partial batch first, so clients never see content shrink
        if (buffer.unflushed > 0) {
            flush(buffer);
        }

        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .roomId(run.getRoomId())
                .threadId(run.getThreadId())
                .content(content)
                .senderKind(Message.SenderKind.RESPONDER)
                .senderId(run.getResponderId())
                .inReplyTo(run.getSourceMessageId())
                .createdAt(clock.instant())
                .build();

        Message stored = runStore.complete(runId, message);
        buffers.remove(runId);

        pubSubPublisher.publishRunCompleted(run.getThreadId(), runId, stored);
        log.info("Run finalized: runId={}, messageId={}, length={}", runId, stored.getId(), content.length());
        return stored.getId();
    }

    /**
     * Marks the run FAILED. Works for runs this instance never opened, such as
     * stale runs left behind by another instance.
     *
     * @return false if the run was already terminal
     */
    public boolean fail(String runId, String reason) {
        RunBuffer buffer = buffers.remove(runId);
        String threadId;
        if (buffer != null) {
            threadId = buffer.run.getThreadId();
        } else {
            threadId = runStore.findById(runId)
                    .map(StreamingRun::getThreadId)
                    .orElseThrow(() -> new NotFoundException("Streaming run not found: " + runId));
        }

        boolean failed = runStore.markFailed(runId, reason);
        if (failed) {
            pubSubPublisher.publishRunFailed(threadId, runId, reason);
            log.info("Run failed: runId={}, threadId={}, reason={}", runId, threadId, reason);
        } else {
            log.debug("Run already terminal, fail ignored: runId={}", runId);
        }
        return failed;
    }

    /**
     * Drops the in-memory buffer without touching the store.
     */
    public void discard(String runId) {
        buffers.remove(runId);
    }

    public int getOpenBufferCount() {
        return buffers.size();
    }

    private void flush(RunBuffer buffer) {
        String content = buffer.content.toString();
        runStore.upsertContent(buffer.run, content);
        buffer.unflushed = 0;
        buffer.flushes++;

        pubSubPublisher.publishRunUpdated(buffer.run.getThreadId(), buffer.run.getId(),
                buffer.run.getResponderId(), content);
        log.debug("Run content flushed: runId={}, length={}, flushes={}",
                buffer.run.getId(), content.length(), buffer.flushes);
    }

    private RunBuffer requireBuffer(String runId) {
        RunBuffer buffer = buffers.get(runId);
        if (buffer == null) {
            throw new IllegalStateException("No open accumulator for run " + runId);
        }
        return buffer;
    }

    private static class RunBuffer {
        final StreamingRun run;
        final StringBuilder content;
        int unflushed;
        int flushes;

        RunBuffer(StreamingRun run) {
            this.run = run;
            this.content = new StringBuilder(run.getContent() != null ? run.getContent() : "");
        }
    }
}
