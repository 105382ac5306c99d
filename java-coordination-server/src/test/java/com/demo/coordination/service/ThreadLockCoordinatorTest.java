package com.demo.coordination.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demo.coordination.domain.LockResult;
import com.demo.coordination.domain.ThreadLock;
import com.demo.coordination.domain.ThreadLock.LockKind;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.infrastructure.ThreadLockStore;
import com.demo.coordination.support.InMemoryThreadLockStore;
import com.demo.coordination.support.MutableClock;
import com.demo.coordination.support.TestProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.RepeatedTest;

class ThreadLockCoordinatorTest {

    private InMemoryThreadLockStore store;
    private MutableClock clock;
    private MetricsService metrics;
    private ThreadLockCoordinator coordinator;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        store = new InMemoryThreadLockStore();
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        metrics = new MetricsService();
        coordinator = new ThreadLockCoordinator(store, TestProperties.defaults(), metrics, clock);
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void producerHandsOverToResponderAndBlocksOtherSenders() {
        LockResult producer = coordinator.acquireProducer("T1", "u1");
        assertThat(producer.isGranted()).isTrue();
        assertThat(producer.getLock().getKind()).isEqualTo(LockKind.PRODUCER);

        LockResult responder = coordinator.transitionToResponder("T1", "u1", "botA");
        assertThat(responder.isGranted()).isTrue();
        assertThat(responder.getLock().getKind()).isEqualTo(LockKind.RESPONDER);
        assertThat(responder.getLock().getHolderId()).isEqualTo("botA");
        assertThat(responder.getLock().getExpiresAt()).isEqualTo(clock.instant().plusSeconds(120));

        LockResult other = coordinator.acquireProducer("T1", "u2");
        assertThat(other.isGranted()).isFalse();
        assertThat(other.getHolderId()).isEqualTo("botA");
        assertThat(other.getKind()).isEqualTo(LockKind.RESPONDER);
        assertThat(other.getRetryAfterSeconds()).isEqualTo(120);
    }

    @Test
    void reacquireBySameProducerExtendsExpiry() {
        coordinator.acquireProducer("T1", "u1");
        clock.advance(Duration.ofSeconds(20));

        String firstToken = store.find("T1").get().getToken();

        LockResult again = coordinator.acquireProducer("T1", "u1");

        assertThat(again.isGranted()).isTrue();
        assertThat(again.getLock().getExpiresAt()).isEqualTo(clock.instant().plusSeconds(30));
        assertThat(again.getLock().getToken()).isNotEqualTo(firstToken);
    }

    @Test
    void producerHeldBySomeoneElseConflictsWithRetryHint() {
        coordinator.acquireProducer("T1", "u1");
        clock.advance(Duration.ofMillis(10_500));

        LockResult result = coordinator.acquireProducer("T1", "u2");

        assertThat(result.isGranted()).isFalse();
        assertThat(result.getKind()).isEqualTo(LockKind.PRODUCER);
        assertThat(result.getHolderId()).isEqualTo("u1");
        // 19.5s left, rounded up
        assertThat(result.getRetryAfterSeconds()).isEqualTo(20);
        assertThat(metrics.getCounter("locks.conflicts")).isEqualTo(1);
    }

    @Test
    void transitionRejectedWhenAnotherParticipantIsComposing() {
        coordinator.acquireProducer("T1", "u1");

        LockResult result = coordinator.transitionToResponder("T1", "u2", "botA");

        assertThat(result.isGranted()).isFalse();
        assertThat(result.getHolderId()).isEqualTo("u1");
        assertThat(coordinator.inspect("T1")).get().extracting(ThreadLock::getKind).isEqualTo(LockKind.PRODUCER);
    }

    @Test
    void transitionRejectedWhileAResponderIsGenerating() {
        coordinator.transitionToResponder("T1", "u1", "botA");

        LockResult sameRequester = coordinator.transitionToResponder("T1", "u1", "botB");
        LockResult sameResponder = coordinator.transitionToResponder("T1", "u1", "botA");

        assertThat(sameRequester.isGranted()).isFalse();
        assertThat(sameResponder.isGranted()).isFalse();
        assertThat(sameRequester.getHolderId()).isEqualTo("botA");
    }

    @Test
    void transitionCreatesResponderLockOnFreeThread() {
        LockResult result = coordinator.transitionToResponder("T1", "u1", "botA");

        assertThat(result.isGranted()).isTrue();
        assertThat(store.find("T1")).get().extracting(ThreadLock::getHolderId).isEqualTo("botA");
    }

    @Test
    void expiredLockIsTreatedAsAbsent() {
        coordinator.acquireProducer("T1", "u1");
        clock.advance(Duration.ofSeconds(31));

        assertThat(coordinator.inspect("T1")).isEmpty();

        LockResult result = coordinator.acquireProducer("T1", "u2");
        assertThat(result.isGranted()).isTrue();
        assertThat(result.getHolderId()).isEqualTo("u2");
    }

    @Test
    void expiredResponderLockDoesNotBlockNewProducer() {
        coordinator.transitionToResponder("T1", "u1", "botA");
        clock.advance(Duration.ofSeconds(121));

        assertThat(coordinator.acquireProducer("T1", "u2").isGranted()).isTrue();
    }

    @Test
    void releaseIsIdempotentAndNeverTouchesAnotherHoldersLock() {
        coordinator.acquireProducer("T1", "u1");

        coordinator.release("T1", "u1");
        coordinator.release("T1", "u1");
        assertThat(coordinator.inspect("T1")).isEmpty();

        coordinator.acquireProducer("T1", "u2");
        coordinator.release("T1", "u1");

        assertThat(coordinator.inspect("T1")).get().extracting(ThreadLock::getHolderId).isEqualTo("u2");
    }

    @Test
    void releaseOfExpiredLockLeavesRowForNextWriter() {
        coordinator.acquireProducer("T1", "u1");
        clock.advance(Duration.ofMinutes(1));

        coordinator.release("T1", "u1");

        assertThat(store.size()).isEqualTo(1);
        assertThat(coordinator.acquireProducer("T1", "u2").isGranted()).isTrue();
    }

    @Test
    void refreshExtendsOnlyTheHoldersLock() {
        coordinator.transitionToResponder("T1", "u1", "botA");
        clock.advance(Duration.ofSeconds(60));

        LockResult refreshed = coordinator.refresh("T1", "botA", Duration.ofSeconds(120));
        assertThat(refreshed.isGranted()).isTrue();
        assertThat(refreshed.getLock().getExpiresAt()).isEqualTo(clock.instant().plusSeconds(120));
        assertThat(refreshed.getLock().getKind()).isEqualTo(LockKind.RESPONDER);

        LockResult foreign = coordinator.refresh("T1", "botB", Duration.ofSeconds(120));
        assertThat(foreign.isGranted()).isFalse();
        assertThat(foreign.getHolderId()).isEqualTo("botA");
    }

    @Test
    void refreshAfterExpiryConflictsWithoutHolder() {
        coordinator.transitionToResponder("T1", "u1", "botA");
        clock.advance(Duration.ofSeconds(121));

        LockResult result = coordinator.refresh("T1", "botA", Duration.ofSeconds(120));

        assertThat(result.isGranted()).isFalse();
        assertThat(result.getLock()).isNull();
        assertThat(result.getRetryAfterSeconds()).isEqualTo(1);
    }

    @RepeatedTest(5)
    void concurrentProducersYieldExactlyOneGrant() throws Exception {
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LockResult>> futures = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            String participant = "u" + i;
            Callable<LockResult> attempt = () -> {
                start.await();
                return coordinator.acquireProducer("T1", participant);
            };
            futures.add(pool.submit(attempt));
        }
        start.countDown();

        List<LockResult> results = new ArrayList<>();
        for (Future<LockResult> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }

        assertThat(results).filteredOn(LockResult::isGranted).hasSize(1);
        String winner = results.stream().filter(LockResult::isGranted).findFirst().get().getHolderId();
        assertThat(results).filteredOn(result -> !result.isGranted())
                .allSatisfy(result -> assertThat(result.getHolderId()).isEqualTo(winner));
    }

    @RepeatedTest(5)
    void concurrentProducerAndResponderYieldExactlyOneGrant() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        Future<LockResult> producer = pool.submit(() -> {
            start.await();
            return coordinator.acquireProducer("T1", "u2");
        });
        Future<LockResult> responder = pool.submit(() -> {
            start.await();
            return coordinator.transitionToResponder("T1", "u1", "botA");
        });
        start.countDown();

        int granted = (producer.get(5, TimeUnit.SECONDS).isGranted() ? 1 : 0)
                + (responder.get(5, TimeUnit.SECONDS).isGranted() ? 1 : 0);
        assertThat(granted).isEqualTo(1);
    }

    @Test
    void persistentWriteFailureOnFreeThreadIsAStoreFailure() {
        ThreadLockStore broken = new InMemoryThreadLockStore() {
            @Override
            public synchronized boolean insertIfAbsent(ThreadLock lock) {
                return false;
            }
        };
        ThreadLockCoordinator flaky = new ThreadLockCoordinator(broken, TestProperties.defaults(), metrics, clock);

        assertThatThrownBy(() -> flaky.acquireProducer("T1", "u1"))
                .isInstanceOf(StoreFailureException.class)
                .hasMessageContaining("T1");
    }

    @Test
    void lostRaceIsReportedAsConflictWithWinner() {
        InMemoryThreadLockStore racing = new InMemoryThreadLockStore() {
            private boolean first = true;

            @Override
            public synchronized Optional<ThreadLock> find(String threadId) {
                Optional<ThreadLock> current = super.find(threadId);
                if (first) {
                    first = false;
                    // Another instance writes between our read and our write
                    put(ThreadLock.builder()
                            .threadId(threadId)
                            .holderId("u9")
                            .kind(LockKind.PRODUCER)
                            .expiresAt(Instant.parse("2024-05-01T10:00:30Z"))
                            .token("winner")
                            .build());
                }
                return current;
            }
        };
        ThreadLockCoordinator coordinatorWithRace =
                new ThreadLockCoordinator(racing, TestProperties.defaults(), metrics, clock);

        LockResult result = coordinatorWithRace.acquireProducer("T1", "u1");

        assertThat(result.isGranted()).isFalse();
        assertThat(result.getHolderId()).isEqualTo("u9");
        assertThat(racing.getFailedWrites()).isEqualTo(1);
    }

    @Test
    void handOverReadBeforeReleaseAndReacquireDoesNotOverwriteNewProducer() {
        SteppingLockStore stepping = new SteppingLockStore();
        ThreadLockCoordinator coordinatorUnderTest =
                new ThreadLockCoordinator(stepping, TestProperties.defaults(), metrics, clock);
        ThreadLockCoordinator otherInstance =
                new ThreadLockCoordinator(stepping, TestProperties.defaults(), metrics, clock);
        otherInstance.acquireProducer("T1", "u1");

        List<LockResult> granted = new ArrayList<>();
        stepping.afterNextRead(() -> {
            otherInstance.release("T1", "u1");
            granted.add(otherInstance.acquireProducer("T1", "u2"));
        });

        LockResult handOver = coordinatorUnderTest.transitionToResponder("T1", "u1", "botA");

        assertThat(granted).singleElement().satisfies(result -> assertThat(result.isGranted()).isTrue());
        assertThat(handOver.isGranted()).isFalse();
        assertThat(handOver.getHolderId()).isEqualTo("u2");
        assertThat(stepping.find("T1")).get().satisfies(lock -> {
            assertThat(lock.getHolderId()).isEqualTo("u2");
            assertThat(lock.getKind()).isEqualTo(LockKind.PRODUCER);
        });
    }

    @Test
    void releaseReadBeforeReleaseAndReacquireLeavesNewHolderAlone() {
        SteppingLockStore stepping = new SteppingLockStore();
        ThreadLockCoordinator coordinatorUnderTest =
                new ThreadLockCoordinator(stepping, TestProperties.defaults(), metrics, clock);
        ThreadLockCoordinator otherInstance =
                new ThreadLockCoordinator(stepping, TestProperties.defaults(), metrics, clock);
        otherInstance.acquireProducer("T1", "u1");

        stepping.afterNextRead(() -> {
            otherInstance.release("T1", "u1");
            otherInstance.acquireProducer("T1", "u2");
        });

        coordinatorUnderTest.release("T1", "u1");

        assertThat(stepping.find("T1")).get().extracting(ThreadLock::getHolderId).isEqualTo("u2");
    }

    @Test
    void releaseThatKeepsBeingRejectedIsAStoreFailure() {
        InMemoryThreadLockStore stuck = new InMemoryThreadLockStore() {
            @Override
            public synchronized boolean deleteIfMatches(String threadId, String expectedToken) {
                return false;
            }
        };
        ThreadLockCoordinator coordinatorWithStuckStore =
                new ThreadLockCoordinator(stuck, TestProperties.defaults(), metrics, clock);
        coordinatorWithStuckStore.acquireProducer("T1", "u1");

        assertThatThrownBy(() -> coordinatorWithStuckStore.release("T1", "u1"))
                .isInstanceOf(StoreFailureException.class)
                .hasMessageContaining("3 attempts");
    }

    @Test
    void releaseWhoseLastDeleteIsReportedLostButLandedIsNotAFailure() {
        InMemoryThreadLockStore flaky = new InMemoryThreadLockStore() {
            private int deletes;

            @Override
            public synchronized boolean deleteIfMatches(String threadId, String expectedToken) {
                deletes++;
                if (deletes < 3) {
                    return false;
                }
                super.deleteIfMatches(threadId, expectedToken);
                return false;
            }
        };
        ThreadLockCoordinator coordinatorWithFlakyStore =
                new ThreadLockCoordinator(flaky, TestProperties.defaults(), metrics, clock);
        coordinatorWithFlakyStore.acquireProducer("T1", "u1");

        coordinatorWithFlakyStore.release("T1", "u1");

        assertThat(flaky.find("T1")).isEmpty();
    }

    /**
     * Runs a step once, right after the next read returns, to interleave
     * another instance between a read and its conditional write.
     */
    private static class SteppingLockStore extends InMemoryThreadLockStore {
        private Runnable pending;

        void afterNextRead(Runnable step) {
            this.pending = step;
        }

        @Override
        public synchronized Optional<ThreadLock> find(String threadId) {
            Optional<ThreadLock> current = super.find(threadId);
            Runnable step = pending;
            pending = null;
            if (step != null) {
                step.run();
            }
            return current;
        }
    }
}
