package com.demo.coordination.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for thread locking and response streaming.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "coordination")
public class CoordinationProperties {

    private Lock lock = new Lock();
    private Stream stream = new Stream();
    private Executor executor = new Executor();
    private Completion completion = new Completion();

    @Getter
    @Setter
    public static class Lock {
        /** Lifetime of a lock held by a human sender. */
        private Duration producerTtl = Duration.ofSeconds(30);

        /** Lifetime of a lock held by a generating responder; refreshed every half-period. */
        private Duration responderTtl = Duration.ofSeconds(120);

        /** Extra lifetime of the Redis key past expiresAt. */
        private Duration keyGrace = Duration.ofSeconds(5);

        /** Read-decide-write attempts before giving up on a contended lock row. */
        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class Stream {
        /** Unflushed characters that trigger a durable write. */
        private int flushThreshold = 50;

        /** Messages of the thread folded into the prompt context. */
        private int historyLimit = 10;

        /** Hard limit on one run, after which it is cancelled. */
        private Duration maxDuration = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private int schedulerPoolSize = 2;
    }

    @Getter
    @Setter
    public static class Completion {
        private String baseUrl = "http://localhost:8000";
        private String streamPath = "/api/qa/professional-stream";
        private String syncPath = "/api/qa/professional-sync";
        private String defaultModel = "gemini-2.5-flash";
        private String embeddingModel = "embedding-001";
        private int topK = 10;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);
    }
}
