package com.demo.coordination.domain;

import com.demo.coordination.exception.LockConflictException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Outcome of a lock coordinator operation: either the granted lock, or the
 * live lock that caused the conflict together with a retry hint.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LockResult {

    private final boolean granted;
    private final ThreadLock lock;
    private final Duration retryAfter;

    public static LockResult granted(ThreadLock lock) {
        return new LockResult(true, lock, Duration.ZERO);
    }

    /**
     * @param holder the live lock that blocked the caller, or null when the
     *               caller expected to hold a lock that no longer exists
     */
    public static LockResult conflict(ThreadLock holder, Duration retryAfter) {
        return new LockResult(false, holder, retryAfter);
    }

    public String getHolderId() {
        return lock != null ? lock.getHolderId() : null;
    }

    public ThreadLock.LockKind getKind() {
        return lock != null ? lock.getKind() : null;
    }

    /**
     * Retry hint rounded up to whole seconds, never below one for a conflict.
     */
    public long getRetryAfterSeconds() {
        if (granted) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    public LockConflictException toConflictException(String threadId) {
        return new LockConflictException(threadId, getHolderId(), getKind(), getRetryAfterSeconds());
    }
}
