package com.demo.coordination.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Streaming Run Entity - one in-flight response generation, shared with
 * clients through row updates and Redis change notifications
 */
@Entity
@Table(name = "streaming_runs", indexes = {
    @Index(name = "idx_run_thread_responder", columnList = "threadId,responderId"),
    @Index(name = "idx_run_state", columnList = "state")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StreamingRun implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final Set<RunState> ACTIVE_STATES = EnumSet.of(RunState.INITIALIZING, RunState.STREAMING);

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 100)
    private String threadId;

    @Column(length = 100)
    private String roomId;

    @Column(nullable = false, length = 100)
    private String responderId;

    @Column(length = 100)
    private String sourceMessageId;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private RunState state;

    @Column(length = 100)
    private String finalRecordId;

    @Column(length = 500)
    private String failureReason;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public boolean isActive() {
        return state != null && ACTIVE_STATES.contains(state);
    }

    public enum RunState {
        INITIALIZING,
        STREAMING,
        COMPLETE,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (state == null) {
            state = RunState.INITIALIZING;
        }
        if (content == null) {
            content = "";
        }
    }
}
