package com.demo.coordination.service;

import com.demo.coordination.domain.OrchestrationState;
import com.demo.coordination.exception.RunCancelledException;
import com.demo.coordination.infrastructure.CompletionStream;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process handle of one running generation, used to cancel it and to
 * follow its state.
 */
@Slf4j
@Getter
public class RunHandle {

    private final String runId;
    private final String threadId;
    private final String responderId;
    private final Instant startTime;

    private final AtomicReference<OrchestrationState> state =
            new AtomicReference<>(OrchestrationState.INITIALIZING);
    @Getter(AccessLevel.NONE)
    private final AtomicInteger increments = new AtomicInteger();

    private volatile boolean cancelled;
    private volatile boolean lockLost;
    private volatile String cancelReason;
    private volatile CompletionStream stream;
    private volatile ScheduledFuture<?> heartbeat;
    private volatile ScheduledFuture<?> deadline;

    public RunHandle(String runId, String threadId, String responderId, Instant startTime) {
        this.runId = runId;
        this.threadId = threadId;
        this.responderId = responderId;
        this.startTime = startTime;
    }

    public OrchestrationState getState() {
        return state.get();
    }

    /**
     * Moves to {@code next}; FAILED is accepted from any non-terminal state.
     *
     * @throws IllegalStateException on a transition the state machine does not allow
     */
    public void transitionTo(OrchestrationState next) {
        OrchestrationState current = state.get();
        while (current.canTransitionTo(next)) {
            if (state.compareAndSet(current, next)) {
                log.debug("Run state: runId={}, {} -> {}", runId, current, next);
                return;
            }
            current = state.get();
        }
        throw new IllegalStateException("Run " + runId + " cannot move from " + current + " to " + next);
    }

    /**
     * Requests cancellation. The generating thread notices it between
     * increments; closing the stream unblocks a pending read.
     */
    public void cancel(String reason) {
        if (cancelled) {
            return;
        }
        cancelReason = reason;
        cancelled = true;
        log.info("Run cancellation requested: runId={}, reason={}", runId, reason);

        CompletionStream current = stream;
        if (current != null) {
            current.close();
        }
    }

    /**
     * Cancellation caused by a lost lock; the lock must then not be released.
     */
    public void markLockLost() {
        lockLost = true;
        cancel("lock lost");
    }

    /**
     * Cancellation by a newer run of the same responder, which owns the lock now.
     */
    public void supersede() {
        lockLost = true;
        cancel("superseded by a newer run");
    }

    public int getIncrementCount() {
        return increments.get();
    }

    void recordIncrement() {
        increments.incrementAndGet();
    }

    /**
     * @throws RunCancelledException if cancellation was requested
     */
    public void checkActive() {
        if (cancelled) {
            throw new RunCancelledException("Run " + runId + " cancelled: " + cancelReason);
        }
    }

    void attachStream(CompletionStream stream) {
        this.stream = stream;
        // A cancel that raced the attach must still abort the read
        if (cancelled) {
            stream.close();
        }
    }

    void setHeartbeat(ScheduledFuture<?> heartbeat) {
        this.heartbeat = heartbeat;
    }

    void setDeadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    void stopTimers() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
        }
        if (deadline != null) {
            deadline.cancel(false);
        }
    }
}
