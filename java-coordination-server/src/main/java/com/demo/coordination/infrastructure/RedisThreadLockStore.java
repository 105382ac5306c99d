package com.demo.coordination.infrastructure;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.ThreadLock;
import com.demo.coordination.exception.StoreFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lock rows as Redis hashes, written through Lua scripts so every
 * check-and-write is one atomic server-side step.
 */
@Component
@Slf4j
public class RedisThreadLockStore implements ThreadLockStore {

    private static final String LOCK_KEY = "thread:lock:{threadId}";

    private static final String INSERT_IF_ABSENT =
            "if redis.call('EXISTS', KEYS[1]) == 1 then return 0 end "
            + "redis.call('HSET', KEYS[1], 'holderId', ARGV[1], 'kind', ARGV[2], 'expiresAt', ARGV[3], 'token', ARGV[4]) "
            + "redis.call('PEXPIRE', KEYS[1], ARGV[5]) "
            + "return 1";

    private static final String COMPARE_AND_SET =
            "if redis.call('HGET', KEYS[1], 'token') ~= ARGV[1] then return 0 end "
            + "redis.call('HSET', KEYS[1], 'holderId', ARGV[2], 'kind', ARGV[3], 'expiresAt', ARGV[4], 'token', ARGV[5]) "
            + "redis.call('PEXPIRE', KEYS[1], ARGV[6]) "
            + "return 1";

    private static final String DELETE_IF_MATCHES =
            "if redis.call('HGET', KEYS[1], 'token') ~= ARGV[1] then return 0 end "
            + "redis.call('DEL', KEYS[1]) "
            + "return 1";

    private static final RedisScript<Long> INSERT_SCRIPT = new DefaultRedisScript<>(INSERT_IF_ABSENT, Long.class);
    private static final RedisScript<Long> CAS_SCRIPT = new DefaultRedisScript<>(COMPARE_AND_SET, Long.class);
    private static final RedisScript<Long> DELETE_SCRIPT = new DefaultRedisScript<>(DELETE_IF_MATCHES, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final CoordinationProperties properties;
    private final Clock clock;

    public RedisThreadLockStore(StringRedisTemplate redisTemplate,
                                CoordinationProperties properties,
                                Clock clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Optional<ThreadLock> find(String threadId) {
        String key = keyFor(threadId);

        try {
            Map<Object, Object> lockData = redisTemplate.opsForHash().entries(key);

            if (lockData.isEmpty()) {
                return Optional.empty();
            }

            ThreadLock lock = ThreadLock.builder()
                    .threadId(threadId)
                    .holderId((String) lockData.get("holderId"))
                    .kind(ThreadLock.LockKind.valueOf((String) lockData.get("kind")))
                    .expiresAt(Instant.ofEpochMilli(Long.parseLong((String) lockData.get("expiresAt"))))
                    .token(requireField(lockData, "token"))
                    .build();
            return Optional.of(lock);

        } catch (DataAccessException e) {
            log.error("Failed to read thread lock: threadId={}", threadId, e);
            throw new StoreFailureException("Thread lock read failed for " + threadId, e);
        } catch (RuntimeException e) {
            // A half-written or foreign hash under our key
            log.error("Unreadable thread lock row: threadId={}", threadId, e);
            throw new StoreFailureException("Thread lock row unreadable for " + threadId, e);
        }
    }

    @Override
    public boolean insertIfAbsent(ThreadLock lock) {
        boolean inserted = run(INSERT_SCRIPT, lock.getThreadId(),
                lock.getHolderId(),
                lock.getKind().name(),
                String.valueOf(lock.getExpiresAt().toEpochMilli()),
                lock.getToken(),
                keyTtlMillis(lock));

        log.debug("Lock insert: threadId={}, holder={}, kind={}, inserted={}",
                lock.getThreadId(), lock.getHolderId(), lock.getKind(), inserted);
        return inserted;
    }

    @Override
    public boolean compareAndSet(String threadId, String expectedToken, ThreadLock replacement) {
        boolean replaced = run(CAS_SCRIPT, threadId,
                expectedToken,
                replacement.getHolderId(),
                replacement.getKind().name(),
                String.valueOf(replacement.getExpiresAt().toEpochMilli()),
                replacement.getToken(),
                keyTtlMillis(replacement));

        log.debug("Lock compare-and-set: threadId={}, expectedToken={}, holder={}, kind={}, replaced={}",
                threadId, expectedToken, replacement.getHolderId(), replacement.getKind(), replaced);
        return replaced;
    }

    @Override
    public boolean deleteIfMatches(String threadId, String expectedToken) {
        boolean deleted = run(DELETE_SCRIPT, threadId, expectedToken);
        log.debug("Lock delete: threadId={}, expectedToken={}, deleted={}", threadId, expectedToken, deleted);
        return deleted;
    }

    private boolean run(RedisScript<Long> script, String threadId, String... args) {
        try {
            Long result = redisTemplate.execute(script, List.of(keyFor(threadId)), (Object[]) args);
            return result != null && result == 1L;
        } catch (DataAccessException e) {
            log.error("Lock script failed: threadId={}", threadId, e);
            throw new StoreFailureException("Thread lock write failed for " + threadId, e);
        }
    }

    /**
     * The key outlives expiresAt by a short grace so an expired row can still
     * be compare-and-set instead of racing a fresh insert.
     */
    String keyTtlMillis(ThreadLock lock) {
        long remaining = Duration.between(clock.instant(), lock.getExpiresAt()).toMillis();
        long ttl = Math.max(remaining, 1L) + properties.getLock().getKeyGrace().toMillis();
        return String.valueOf(ttl);
    }

    private static String requireField(Map<Object, Object> lockData, String field) {
        Object value = lockData.get(field);
        if (value == null) {
            throw new IllegalStateException("Lock row is missing " + field);
        }
        return (String) value;
    }

    static String keyFor(String threadId) {
        return LOCK_KEY.replace("{threadId}", threadId);
    }
}
