package com.demo.coordination.exception;

import com.demo.coordination.domain.ThreadLock;
import lombok.Getter;

/**
 * Another participant holds the thread. Callers should retry after {@link #getRetryAfterSeconds()}.
 */
@Getter
public class LockConflictException extends RuntimeException {

    private final String threadId;
    private final String holderId;
    private final ThreadLock.LockKind kind;
    private final long retryAfterSeconds;

    public LockConflictException(String threadId, String holderId, ThreadLock.LockKind kind, long retryAfterSeconds) {
        super(describe(threadId, kind));
        this.threadId = threadId;
        this.holderId = holderId;
        this.kind = kind;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    private static String describe(String threadId, ThreadLock.LockKind kind) {
        if (kind == ThreadLock.LockKind.RESPONDER) {
            return "A responder is already generating for thread " + threadId + ". Please wait.";
        }
        if (kind == ThreadLock.LockKind.PRODUCER) {
            return "Another participant is currently sending a message in thread " + threadId + ". Please wait.";
        }
        return "Could not acquire lock for thread " + threadId;
    }
}
