package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.ThreadLock;

import java.util.Optional;

/**
 * Atomic row operations against the shared lock table.
 *
 * Each write is a single conditional operation. Implementations never apply
 * expiry rules themselves; an expired row is returned as-is and the
 * coordinator decides what it means.
 */
public interface ThreadLockStore {

    Optional<ThreadLock> find(String threadId);

    /**
     * Writes the lock only if no row exists for its thread.
     *
     * @return true if the row was created
     */
    boolean insertIfAbsent(ThreadLock lock);

    /**
     * Replaces the row only if its current token equals {@code expectedToken}.
     *
     * @return true if the row was replaced
     */
    boolean compareAndSet(String threadId, String expectedToken, ThreadLock replacement);

    /**
     * Deletes the row only if its current token equals {@code expectedToken}.
     *
     * @return true if the row was deleted
     */
    boolean deleteIfMatches(String threadId, String expectedToken);
}
