package com.demo.coordination.infrastructure;

import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.PubSubMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Fans run changes out to every node and client watching a thread.
 *
 * Notifications are fire-and-forget: a failed publish is logged and never
 * fails the run that caused it.
 */
@Component
@Slf4j
public class RedisPubSubPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    private static final String RUN_CHANNEL = "thread:channel:{threadId}:run";

    public RedisPubSubPublisher(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish accumulated content of an active run
     */
    public void publishRunUpdated(String threadId, String runId, String responderId, String content) {
        Map<String, Object> data = new HashMap<>();
        data.put("content", content);
        data.put("contentLength", content != null ? content.length() : 0);

        publish(PubSubMessage.builder()
                .type(PubSubMessage.Type.RUN_UPDATED)
                .threadId(threadId)
                .runId(runId)
                .responderId(responderId)
                .data(data)
                .timestamp(Instant.now())
                .build());
    }

    /**
     * Publish completion with the permanent message
     */
    public void publishRunCompleted(String threadId, String runId, Message message) {
        publish(PubSubMessage.builder()
                .type(PubSubMessage.Type.RUN_COMPLETED)
                .threadId(threadId)
                .runId(runId)
                .responderId(message.getSenderId())
                .data(message)
                .timestamp(Instant.now())
                .build());
    }

    /**
     * Publish failure of a run
     */
    public void publishRunFailed(String threadId, String runId, String reason) {
        publish(PubSubMessage.builder()
                .type(PubSubMessage.Type.RUN_FAILED)
                .threadId(threadId)
                .runId(runId)
                .error(reason)
                .timestamp(Instant.now())
                .build());
    }

    private void publish(PubSubMessage message) {
        String channel = channelFor(message.getThreadId());

        try {
            String payload = objectMapper.writeValueAsString(message);
            Long subscribers = redisTemplate.convertAndSend(channel, payload);

            if (subscribers == null || subscribers == 0) {
                log.debug("No active subscribers for thread: {}", message.getThreadId());
            }

            log.debug("Published {}: threadId={}, runId={}, subscribers={}",
                    message.getType(), message.getThreadId(), message.getRunId(), subscribers);

        } catch (Exception e) {
            log.error("Failed to publish {}: threadId={}, runId={}",
                    message.getType(), message.getThreadId(), message.getRunId(), e);
        }
    }

    static String channelFor(String threadId) {
        return RUN_CHANNEL.replace("{threadId}", threadId);
    }
}
