package com.demo.coordination.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Exclusive lock on a conversation thread.
 *
 * Stored in Redis as a hash. A lock whose expiresAt has passed is treated as
 * absent by every coordinator operation, whether or not the key is still there.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ThreadLock implements Serializable {
    private static final long serialVersionUID = 1L;

    private String threadId;
    private String holderId;
    private LockKind kind;
    private Instant expiresAt;

    // Fresh on every write and never reused, even after the row is deleted,
    // so a stale reader's compare-and-set cannot hit a newer holder's row
    private String token;

    public boolean isLive(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String participantId) {
        return holderId != null && holderId.equals(participantId);
    }

    public enum LockKind {
        /** A human is composing or sending a message. */
        PRODUCER,
        /** An automated responder is generating. */
        RESPONDER
    }
}
