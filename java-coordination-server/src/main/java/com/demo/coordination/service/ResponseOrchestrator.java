package com.demo.coordination.service;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.LockResult;
import com.demo.coordination.domain.OrchestrationState;
import com.demo.coordination.domain.RunRequest;
import com.demo.coordination.domain.StreamingRun;
import com.demo.coordination.exception.ProviderFailureException;
import com.demo.coordination.exception.RunCancelledException;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.infrastructure.CompletionSource;
import com.demo.coordination.infrastructure.CompletionStream;
import com.demo.coordination.infrastructure.StreamingRunStore;
import com.demo.coordination.service.selection.SelectionResolver;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Response Orchestrator
 *
 * Runs one responder generation in the background:
 * - retires stale runs of the same responder on the thread
 * - assembles the prompt context and opens the completion stream
 * - drains increments into the accumulator while keeping the lock alive
 * - finalizes or fails the run, then releases the lock
 * - hands successful moderator runs to the chainer
 *
 * The caller must already hold the RESPONDER lock for the responder.
 */
@Service
@Slf4j
public class ResponseOrchestrator implements RunLauncher {

    private final StreamingRunStore runStore;
    private final StreamAccumulator accumulator;
    private final PromptContextAssembler contextAssembler;
    private final CompletionSource completionSource;
    private final ThreadLockCoordinator lockCoordinator;
    private final SelectionResolver selectionResolver;
    private final ModeratorChainer moderatorChainer;
    private final MetricsService metricsService;
    private final CoordinationProperties properties;
    private final Clock clock;
    private final TaskExecutor runExecutor;
    private final TaskScheduler runScheduler;

    // Optional: Kafka event publisher (null if Kafka is disabled)
    private final RunEventPublisher eventPublisher;

    // Runs executing on this instance, for cancellation
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public ResponseOrchestrator(StreamingRunStore runStore,
                                StreamAccumulator accumulator,
                                PromptContextAssembler contextAssembler,
                                CompletionSource completionSource,
                                ThreadLockCoordinator lockCoordinator,
                                SelectionResolver selectionResolver,
                                ModeratorChainer moderatorChainer,
                                MetricsService metricsService,
                                CoordinationProperties properties,
                                Clock clock,
                                @Qualifier("runExecutor") TaskExecutor runExecutor,
                                @Qualifier("runScheduler") TaskScheduler runScheduler,
                                @Autowired(required = false) RunEventPublisher eventPublisher) {
        this.runStore = runStore;
        this.accumulator = accumulator;
        this.contextAssembler = contextAssembler;
        this.completionSource = completionSource;
        this.lockCoordinator = lockCoordinator;
        this.selectionResolver = selectionResolver;
        this.moderatorChainer = moderatorChainer;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
        this.runExecutor = runExecutor;
        this.runScheduler = runScheduler;
        this.eventPublisher = eventPublisher;

        if (eventPublisher != null) {
            log.info("Kafka RunEventPublisher enabled for run lifecycle events");
        } else {
            log.info("Kafka RunEventPublisher disabled - using Redis PubSub only");
        }
    }

    @Override
    public String launch(RunRequest request) {
        StreamingRun run = prepare(request);
        RunHandle handle = activeRuns.get(run.getId());

        try {
            runExecutor.execute(() -> execute(handle, run, request));
        } catch (TaskRejectedException e) {
            log.error("Run rejected, executor saturated: runId={}, threadId={}", run.getId(), run.getThreadId(), e);
            activeRuns.remove(run.getId());
            accumulator.fail(run.getId(), "rejected: no capacity");
            metricsService.recordRunFailed(run.getId(), "REJECTED");
            throw e;
        }
        return run.getId();
    }

    /**
     * Requests cancellation of a run executing on this instance.
     *
     * @return false if the run is not active here
     */
    public boolean cancel(String runId) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            log.debug("Cancel ignored, run not active on this instance: runId={}", runId);
            return false;
        }
        handle.cancel("cancelled by request");
        return true;
    }

    Optional<RunHandle> findActiveRun(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    public int getActiveRunCount() {
        return activeRuns.size();
    }

    @PreDestroy
    public void shutdown() {
        if (!activeRuns.isEmpty()) {
            log.info("Cancelling {} active runs on shutdown", activeRuns.size());
        }
        activeRuns.values().forEach(handle -> handle.cancel("server shutting down"));
    }

    /**
     * Retires stale active runs of the pair and creates the new run record.
     */
    StreamingRun prepare(RunRequest request) {
        for (StreamingRun stale : runStore.findActive(request.getThreadId(), request.getResponderId())) {
            RunHandle local = activeRuns.get(stale.getId());
            if (local != null) {
                local.supersede();
            }
            accumulator.fail(stale.getId(), "superseded by a newer run");
            log.info("Stale run retired: runId={}, threadId={}, responderId={}",
                    stale.getId(), stale.getThreadId(), stale.getResponderId());
        }

        StreamingRun run = runStore.create(StreamingRun.builder()
                .id(UUID.randomUUID().toString())
                .threadId(request.getThreadId())
                .roomId(request.getRoomId())
                .responderId(request.getResponderId())
                .sourceMessageId(request.getSourceMessageId())
                .content("")
                .state(StreamingRun.RunState.INITIALIZING)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build());

        accumulator.open(run);
        activeRuns.put(run.getId(), new RunHandle(run.getId(), run.getThreadId(), run.getResponderId(), clock.instant()));

        metricsService.recordRunStarted(run.getId());
        if (eventPublisher != null) {
            eventPublisher.publishRunStarted(run);
        }
        log.info("Run created: runId={}, threadId={}, responderId={}, chainingAllowed={}",
                run.getId(), run.getThreadId(), run.getResponderId(), request.isChainingAllowed());
        return run;
    }

    void execute(RunHandle handle, StreamingRun run, RunRequest request) {
        String runId = run.getId();
        RunContext context = null;
        String output = null;
        boolean completed = false;

        handle.setDeadline(runScheduler.schedule(
                () -> handle.cancel("exceeded max duration"),
                clock.instant().plus(properties.getStream().getMaxDuration())));

        try {
            context = contextAssembler.assemble(run);
            handle.checkActive();

            try (CompletionStream stream = completionSource.generate(context.getCompletionRequest())) {
                handle.attachStream(stream);
                if (!runStore.markStreaming(runId)) {
                    throw new RunCancelledException("Run " + runId + " was retired before streaming");
                }
                handle.transitionTo(OrchestrationState.STREAMING);
                startHeartbeat(handle);

                output = drain(handle, stream, context.isModerator());
            }

            handle.checkActive();
            handle.transitionTo(OrchestrationState.COMPLETING);

            String finalContent = output;
            if (context.isModerator()) {
                // Moderators show the decoded message, never the raw selection payload
                finalContent = selectionResolver.displayText(output);
                accumulator.append(runId, finalContent);
            }
            String messageId = accumulator.finalizeRun(runId, finalContent);

            handle.transitionTo(OrchestrationState.COMPLETE);
            completed = true;

            Duration duration = Duration.between(handle.getStartTime(), clock.instant());
            metricsService.recordRunCompleted(runId, duration, handle.getIncrementCount());
            if (eventPublisher != null) {
                eventPublisher.publishRunCompleted(runId, run.getThreadId(), messageId, duration);
            }

        } catch (RunCancelledException e) {
            failRun(handle, "cancelled: " + handle.getCancelReason(), "CANCELLED");
        } catch (RuntimeException e) {
            if (handle.isCancelled()) {
                // Closing the stream or retiring the buffer surfaces as an error in the draining thread
                log.debug("Run error after cancellation: runId={}, error={}", runId, e.toString());
                failRun(handle, "cancelled: " + handle.getCancelReason(), "CANCELLED");
            } else {
                handleFailure(handle, run, e);
            }
        } finally {
            handle.stopTimers();
            activeRuns.remove(runId);
            if (handle.isLockLost()) {
                log.warn("Lock not released, no longer held: runId={}, threadId={}", runId, run.getThreadId());
            } else {
                releaseLock(run.getThreadId(), run.getResponderId());
            }
        }

        if (completed && context.isModerator() && request.isChainingAllowed()) {
            chain(run, context, output);
        }
    }

    /**
     * Refreshes the run's lock; a conflict means another participant took the
     * thread and the run must stop.
     */
    void refreshLock(RunHandle handle) {
        Duration ttl = properties.getLock().getResponderTtl();
        try {
            LockResult result = lockCoordinator.refresh(handle.getThreadId(), handle.getResponderId(), ttl);
            if (!result.isGranted()) {
                log.warn("Lock lost during run: runId={}, threadId={}, holderId={}",
                        handle.getRunId(), handle.getThreadId(), result.getHolderId());
                metricsService.recordLockLost();
                handle.markLockLost();
            }
        } catch (StoreFailureException e) {
            // Next heartbeat retries; the TTL covers one missed refresh
            log.warn("Lock refresh failed: runId={}, threadId={}", handle.getRunId(), handle.getThreadId(), e);
        }
    }

    private String drain(RunHandle handle, CompletionStream stream, boolean moderator) {
        StringBuilder raw = new StringBuilder();
        while (true) {
            handle.checkActive();
            if (!stream.hasNext()) {
                break;
            }
            String delta = stream.next();
            handle.checkActive();
            handle.recordIncrement();

            raw.append(delta);
            if (!moderator) {
                accumulator.append(handle.getRunId(), delta);
            }
        }
        log.debug("Stream drained: runId={}, increments={}, length={}",
                handle.getRunId(), handle.getIncrementCount(), raw.length());
        return raw.toString();
    }

    private void startHeartbeat(RunHandle handle) {
        Duration period = properties.getLock().getResponderTtl().dividedBy(2);
        handle.setHeartbeat(runScheduler.scheduleAtFixedRate(
                () -> refreshLock(handle),
                clock.instant().plus(period),
                period));
    }

    private void chain(StreamingRun run, RunContext context, String output) {
        try {
            Optional<String> chainedRunId = moderatorChainer.maybeChain(
                    run.getThreadId(),
                    run.getRoomId(),
                    run.getSourceMessageId(),
                    run.getResponderId(),
                    output,
                    context.getRoomResponders());

            chainedRunId.ifPresent(chainedId -> {
                metricsService.recordRunChained(run.getId(), chainedId);
                if (eventPublisher != null) {
                    eventPublisher.publishRunChained(run.getId(), chainedId, run.getThreadId());
                }
            });
        } catch (RuntimeException e) {
            log.error("Moderator chaining failed: runId={}, threadId={}", run.getId(), run.getThreadId(), e);
            metricsService.recordError(e.getClass().getSimpleName(), "ResponseOrchestrator");
        }
    }

    private void handleFailure(RunHandle handle, StreamingRun run, RuntimeException e) {
        if (e instanceof ProviderFailureException) {
            log.error("Completion source failed: runId={}, threadId={}", run.getId(), run.getThreadId(), e);
            failRun(handle, "provider failure: " + e.getMessage(), "PROVIDER_FAILURE");
        } else if (e instanceof StoreFailureException) {
            log.error("Store failure during run: runId={}, threadId={}", run.getId(), run.getThreadId(), e);
            failRun(handle, "store failure: " + e.getMessage(), "STORE_FAILURE");
        } else {
            log.error("Unexpected error during run: runId={}, threadId={}", run.getId(), run.getThreadId(), e);
            failRun(handle, "internal error: " + e.getClass().getSimpleName(), e.getClass().getSimpleName());
        }
    }

    private void failRun(RunHandle handle, String reason, String errorType) {
        if (handle.getState().canTransitionTo(OrchestrationState.FAILED)) {
            handle.transitionTo(OrchestrationState.FAILED);
        }
        try {
            accumulator.fail(handle.getRunId(), reason);
        } catch (RuntimeException e) {
            log.error("Could not mark run failed: runId={}", handle.getRunId(), e);
            accumulator.discard(handle.getRunId());
        }

        metricsService.recordRunFailed(handle.getRunId(), errorType);
        if (eventPublisher != null) {
            eventPublisher.publishRunFailed(handle.getRunId(), handle.getThreadId(), reason);
        }
    }

    private void releaseLock(String threadId, String responderId) {
        try {
            lockCoordinator.release(threadId, responderId);
        } catch (StoreFailureException e) {
            // Expiry frees the thread eventually
            log.error("Failed to release lock: threadId={}, holderId={}", threadId, responderId, e);
            metricsService.recordError("LOCK_RELEASE_FAILED", "ResponseOrchestrator");
        }
    }
}
