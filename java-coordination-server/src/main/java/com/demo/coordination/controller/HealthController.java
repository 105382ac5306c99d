package com.demo.coordination.controller;

import com.demo.coordination.service.ResponseOrchestrator;
import com.demo.coordination.service.StreamAccumulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final ResponseOrchestrator orchestrator;
    private final StreamAccumulator accumulator;

    public HealthController(StringRedisTemplate redisTemplate,
                            ResponseOrchestrator orchestrator,
                            StreamAccumulator accumulator) {
        this.redisTemplate = redisTemplate;
        this.orchestrator = orchestrator;
        this.accumulator = accumulator;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("activeRuns", orchestrator.getActiveRunCount());
        response.put("openBuffers", accumulator.getOpenBufferCount());

        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            response.put("redis", "connected");
        } catch (DataAccessException e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            response.put("redis", "disconnected");
            response.put("status", "degraded");
        }

        return response;
    }
}
