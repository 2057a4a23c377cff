package com.taskq.gateway.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Health", description = "Infrastructure health checks")
public class HealthController {

    private final StringRedisTemplate redisTemplate;

    public HealthController(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Operation(summary = "Health check", description = "Pings the Redis queue store. Returns 200 if UP, 503 if DOWN.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        Map<String, String> components = new LinkedHashMap<>();
        boolean up;

        try (RedisConnection connection = redisTemplate.getConnectionFactory().getConnection()) {
            connection.ping();
            components.put("redis", "UP");
            up = true;
        } catch (Exception e) {
            components.put("redis", "DOWN");
            up = false;
        }

        result.put("status", up ? "UP" : "DEGRADED");
        result.put("components", components);
        return up ? ResponseEntity.ok(result)
                  : ResponseEntity.status(503).body(result);
    }
}
