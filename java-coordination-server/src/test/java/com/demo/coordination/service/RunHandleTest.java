package com.demo.coordination.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demo.coordination.domain.OrchestrationState;
import com.demo.coordination.exception.RunCancelledException;
import com.demo.coordination.infrastructure.CompletionStream;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RunHandleTest {

    private final RunHandle handle = new RunHandle("run-1", "T1", "ds", Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void followsTheHappyPath() {
        handle.transitionTo(OrchestrationState.STREAMING);
        handle.transitionTo(OrchestrationState.COMPLETING);
        handle.transitionTo(OrchestrationState.COMPLETE);

        assertThat(handle.getState()).isEqualTo(OrchestrationState.COMPLETE);
    }

    @Test
    void cannotSkipStreaming() {
        assertThatThrownBy(() -> handle.transitionTo(OrchestrationState.COMPLETING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("INITIALIZING");
    }

    @ParameterizedTest
    @EnumSource(value = OrchestrationState.class, names = {"INITIALIZING", "STREAMING", "COMPLETING"})
    void anyLiveStateCanFail(OrchestrationState from) {
        assertThat(from.canTransitionTo(OrchestrationState.FAILED)).isTrue();
    }

    @Test
    void terminalStatesAreFinal() {
        handle.transitionTo(OrchestrationState.FAILED);

        for (OrchestrationState next : OrchestrationState.values()) {
            assertThat(OrchestrationState.FAILED.canTransitionTo(next)).isFalse();
            assertThat(OrchestrationState.COMPLETE.canTransitionTo(next)).isFalse();
        }
        assertThatThrownBy(() -> handle.transitionTo(OrchestrationState.FAILED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelClosesTheAttachedStreamOnce() {
        AtomicInteger closes = new AtomicInteger();
        handle.attachStream(closingStream(closes));

        handle.cancel("user request");
        handle.cancel("again");

        assertThat(closes).hasValue(1);
        assertThat(handle.getCancelReason()).isEqualTo("user request");
        assertThatThrownBy(handle::checkActive)
                .isInstanceOf(RunCancelledException.class)
                .hasMessageContaining("user request");
    }

    @Test
    void streamAttachedAfterCancelIsClosedImmediately() {
        AtomicInteger closes = new AtomicInteger();
        handle.cancel("exceeded max duration");

        handle.attachStream(closingStream(closes));

        assertThat(closes).hasValue(1);
    }

    @Test
    void lostLockKeepsTheLockOutOfRelease() {
        handle.markLockLost();

        assertThat(handle.isLockLost()).isTrue();
        assertThat(handle.isCancelled()).isTrue();
        assertThat(handle.getCancelReason()).isEqualTo("lock lost");
    }

    private static CompletionStream closingStream(AtomicInteger closes) {
        return new CompletionStream() {
            @Override
            public boolean hasNext() {
                return false;
            }

            @Override
            public String next() {
                throw new NoSuchElementException();
            }

            @Override
            public void close() {
                closes.incrementAndGet();
            }
        };
    }
}
