package com.demo.coordination.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Change notification fanned out to every client watching a thread.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PubSubMessage {
    private Type type;
    private String threadId;
    private String runId;
    private String responderId;
    private Object data;
    private String error;
    private Instant timestamp;

    public enum Type {
        RUN_UPDATED,
        RUN_COMPLETED,
        RUN_FAILED
    }
}
