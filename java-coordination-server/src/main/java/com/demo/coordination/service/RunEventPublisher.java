package com.demo.coordination.service;

import com.demo.coordination.domain.StreamingRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Run lifecycle events on Kafka (optional)
 *
 * Audit and analytics only; nothing in the coordination path reads them.
 * Enable with: spring.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class RunEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${coordination.kafka.topics.run-events:run-events}")
    private String runEventsTopic;

    public RunEventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishRunStarted(StreamingRun run) {
        Map<String, Object> event = baseEvent("RUN_STARTED", run.getId(), run.getThreadId());
        event.put("roomId", run.getRoomId());
        event.put("responderId", run.getResponderId());
        event.put("sourceMessageId", run.getSourceMessageId());

        publishEvent(run.getThreadId(), event, "RUN_STARTED");
    }

    public void publishRunCompleted(String runId, String threadId, String messageId, Duration duration) {
        Map<String, Object> event = baseEvent("RUN_COMPLETED", runId, threadId);
        event.put("messageId", messageId);
        event.put("durationMs", duration.toMillis());

        publishEvent(threadId, event, "RUN_COMPLETED");
    }

    public void publishRunFailed(String runId, String threadId, String reason) {
        Map<String, Object> event = baseEvent("RUN_FAILED", runId, threadId);
        event.put("reason", reason);

        publishEvent(threadId, event, "RUN_FAILED");
    }

    public void publishRunChained(String moderatorRunId, String chainedRunId, String threadId) {
        Map<String, Object> event = baseEvent("RUN_CHAINED", chainedRunId, threadId);
        event.put("moderatorRunId", moderatorRunId);

        publishEvent(threadId, event, "RUN_CHAINED");
    }

    private Map<String, Object> baseEvent(String eventType, String runId, String threadId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("runId", runId);
        event.put("threadId", threadId);
        return event;
    }

    // Keyed by thread so one thread's events stay ordered within a partition
    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(runEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, runEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, runEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "RunEventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "RunEventPublisher");
        }
    }
}
