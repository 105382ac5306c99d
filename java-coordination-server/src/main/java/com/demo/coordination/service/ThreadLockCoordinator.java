package com.demo.coordination.service;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.LockResult;
import com.demo.coordination.domain.ThreadLock;
import com.demo.coordination.domain.ThreadLock.LockKind;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.infrastructure.ThreadLockStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Exclusive per-thread lock shared by human senders and responders.
 *
 * The store is the only source of truth. Every operation reads the current
 * row, decides against the clock, then issues one conditional write. A lost
 * race re-reads and decides again instead of overwriting.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThreadLockCoordinator {

    private final ThreadLockStore lockStore;
    private final CoordinationProperties properties;
    private final MetricsService metricsService;
    private final Clock clock;

    /**
     * Grants a PRODUCER lock to a human participant. Re-granting to the current
     * producer extends the expiry.
     */
    public LockResult acquireProducer(String threadId, String participantId) {
        Duration ttl = properties.getLock().getProducerTtl();
        LockResult result = mutate(threadId, "acquireProducer", current -> {
            if (current == null) {
                return Decision.write(participantId, LockKind.PRODUCER, ttl);
            }
            if (current.getKind() == LockKind.PRODUCER && current.isHeldBy(participantId)) {
                return Decision.write(participantId, LockKind.PRODUCER, ttl);
            }
            return Decision.conflict();
        });
        logOutcome("acquireProducer", threadId, participantId, result);
        return result;
    }

    /**
     * Hands the thread over to a responder. Succeeds when the thread is free or
     * the live PRODUCER lock belongs to the requester.
     */
    public LockResult transitionToResponder(String threadId, String requestingParticipantId, String responderId) {
        Duration ttl = properties.getLock().getResponderTtl();
        LockResult result = mutate(threadId, "transitionToResponder", current -> {
            if (current == null) {
                return Decision.write(responderId, LockKind.RESPONDER, ttl);
            }
            if (current.getKind() == LockKind.PRODUCER && current.isHeldBy(requestingParticipantId)) {
                return Decision.write(responderId, LockKind.RESPONDER, ttl);
            }
            return Decision.conflict();
        });
        logOutcome("transitionToResponder", threadId, responderId, result);
        return result;
    }

    /**
     * Extends the caller's live lock by {@code extension} from now.
     */
    public LockResult refresh(String threadId, String holderId, Duration extension) {
        LockResult result = mutate(threadId, "refresh", current -> {
            if (current != null && current.isHeldBy(holderId)) {
                return Decision.write(holderId, current.getKind(), extension);
            }
            return Decision.conflict();
        });
        if (!result.isGranted()) {
            log.warn("Lock refresh rejected: threadId={}, holderId={}, currentHolder={}",
                    threadId, holderId, result.getHolderId());
        }
        return result;
    }

    /**
     * Deletes the caller's live lock. Absent, expired or foreign locks are left
     * untouched, so calling this twice is harmless.
     *
     * @throws StoreFailureException if the store fails, or if the caller still
     *         holds the lock after every delete attempt was rejected
     */
    public void release(String threadId, String holderId) {
        int maxAttempts = properties.getLock().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<ThreadLock> current = lockStore.find(threadId);
            if (current.isEmpty() || !current.get().isLive(now()) || !current.get().isHeldBy(holderId)) {
                log.debug("Release skipped, not held: threadId={}, holderId={}", threadId, holderId);
                return;
            }
            if (lockStore.deleteIfMatches(threadId, current.get().getToken())) {
                metricsService.recordLockReleased();
                log.info("Lock released: threadId={}, holderId={}", threadId, holderId);
                return;
            }
            log.debug("Release lost a race, retrying: threadId={}, attempt={}", threadId, attempt);
        }

        // Either another writer settled it, or the deletes are not reaching the store
        Optional<ThreadLock> last = lockStore.find(threadId);
        if (last.isEmpty() || !last.get().isLive(now()) || !last.get().isHeldBy(holderId)) {
            log.debug("Release settled by a concurrent write: threadId={}, holderId={}", threadId, holderId);
            return;
        }
        throw new StoreFailureException("Could not release lock on thread " + threadId
                + " after " + maxAttempts + " attempts");
    }

    /**
     * The live lock of a thread, if any.
     */
    public Optional<ThreadLock> inspect(String threadId) {
        return lockStore.find(threadId).filter(lock -> lock.isLive(now()));
    }

    private LockResult mutate(String threadId, String operation, Policy policy) {
        int maxAttempts = properties.getLock().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant now = now();
            Optional<ThreadLock> stored = lockStore.find(threadId);
            ThreadLock live = stored.filter(lock -> lock.isLive(now)).orElse(null);

            Decision decision = policy.decide(live);
            if (!decision.isWrite()) {
                return conflict(live, now, operation);
            }

            ThreadLock replacement = ThreadLock.builder()
                    .threadId(threadId)
                    .holderId(decision.getHolderId())
                    .kind(decision.getKind())
                    .expiresAt(now.plus(decision.getTtl()))
                    .token(UUID.randomUUID().toString())
                    .build();

            boolean written = stored.isPresent()
                    ? lockStore.compareAndSet(threadId, stored.get().getToken(), replacement)
                    : lockStore.insertIfAbsent(replacement);
            if (written) {
                metricsService.recordLockGranted(operation, replacement.getKind().name());
                return LockResult.granted(replacement);
            }
            log.debug("Lock write lost a race: threadId={}, operation={}, attempt={}",
                    threadId, operation, attempt);
        }

        // Persistent contention: report whoever won, if anyone still holds it
        Instant now = now();
        Optional<ThreadLock> winner = lockStore.find(threadId).filter(lock -> lock.isLive(now));
        if (winner.isPresent()) {
            return conflict(winner.get(), now, operation);
        }
        throw new StoreFailureException("Lock on thread " + threadId + " kept changing during "
                + operation + " after " + maxAttempts + " attempts");
    }

    private LockResult conflict(ThreadLock live, Instant now, String operation) {
        Duration retryAfter = live != null
                ? Duration.between(now, live.getExpiresAt())
                : Duration.ZERO;
        metricsService.recordLockConflict(operation, live != null ? live.getKind().name() : "NONE");
        return LockResult.conflict(live, retryAfter);
    }

    private void logOutcome(String operation, String threadId, String participantId, LockResult result) {
        if (result.isGranted()) {
            log.info("Lock granted: operation={}, threadId={}, holderId={}, kind={}, expiresAt={}",
                    operation, threadId, participantId, result.getKind(), result.getLock().getExpiresAt());
        } else {
            log.warn("Lock conflict: operation={}, threadId={}, requester={}, holderId={}, kind={}, retryAfter={}s",
                    operation, threadId, participantId, result.getHolderId(), result.getKind(),
                    result.getRetryAfterSeconds());
        }
    }

    private Instant now() {
        return clock.instant();
    }

    @FunctionalInterface
    private interface Policy {
        /**
         * @param live the current live lock, or null when the thread is free
         */
        Decision decide(ThreadLock live);
    }

    @Value
    private static class Decision {
        boolean write;
        String holderId;
        LockKind kind;
        Duration ttl;

        static Decision write(String holderId, LockKind kind, Duration ttl) {
            return new Decision(true, holderId, kind, ttl);
        }

        static Decision conflict() {
            return new Decision(false, null, null, null);
        }
    }
}
