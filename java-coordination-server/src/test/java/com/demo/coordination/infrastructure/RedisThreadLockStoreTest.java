package com.demo.coordination.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.ThreadLock;
import com.demo.coordination.domain.ThreadLock.LockKind;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

class RedisThreadLockStoreTest {

    private StringRedisTemplate redisTemplate;
    private HashOperations<String, Object, Object> hashOperations;
    private MutableClock clock;
    private RedisThreadLockStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        hashOperations = mock(HashOperations.class);
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new RedisThreadLockStore(redisTemplate, new CoordinationProperties(), clock);
    }

    @Test
    void readsLockHash() {
        when(hashOperations.entries("thread:lock:T1")).thenReturn(Map.of(
                "holderId", "botA",
                "kind", "RESPONDER",
                "expiresAt", String.valueOf(Instant.parse("2024-05-01T10:02:00Z").toEpochMilli()),
                "token", "3f1c9a2e-token"));

        ThreadLock lock = store.find("T1").orElseThrow();

        assertThat(lock.getThreadId()).isEqualTo("T1");
        assertThat(lock.getHolderId()).isEqualTo("botA");
        assertThat(lock.getKind()).isEqualTo(LockKind.RESPONDER);
        assertThat(lock.getExpiresAt()).isEqualTo(Instant.parse("2024-05-01T10:02:00Z"));
        assertThat(lock.getToken()).isEqualTo("3f1c9a2e-token");
    }

    @Test
    void missingKeyMeansNoLock() {
        when(hashOperations.entries("thread:lock:T1")).thenReturn(Map.of());

        assertThat(store.find("T1")).isEmpty();
    }

    @Test
    void halfWrittenHashIsAStoreFailure() {
        when(hashOperations.entries("thread:lock:T1")).thenReturn(Map.of("holderId", "botA"));

        assertThatThrownBy(() -> store.find("T1"))
                .isInstanceOf(StoreFailureException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void unreachableRedisIsAStoreFailure() {
        when(hashOperations.entries("thread:lock:T1"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.find("T1"))
                .isInstanceOf(StoreFailureException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void scriptResultDecidesTheWrite() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenReturn(1L, 0L);

        assertThat(store.insertIfAbsent(lock("a"))).isTrue();
        assertThat(store.compareAndSet("T1", "a", lock("b"))).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void failedScriptIsAStoreFailure() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(Object[].class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.deleteIfMatches("T1", "a"))
                .isInstanceOf(StoreFailureException.class)
                .hasMessageContaining("T1");
    }

    @Test
    void keyOutlivesExpiryByTheGrace() {
        assertThat(store.keyTtlMillis(lock("a"))).isEqualTo("35000");

        // Already expired rows still get the grace
        clock.advance(Duration.ofMinutes(5));
        assertThat(store.keyTtlMillis(lock("a"))).isEqualTo("5001");
    }

    private static ThreadLock lock(String token) {
        return ThreadLock.builder()
                .threadId("T1")
                .holderId("u1")
                .kind(LockKind.PRODUCER)
                .expiresAt(Instant.parse("2024-05-01T10:00:30Z"))
                .token(token)
                .build();
    }
}
