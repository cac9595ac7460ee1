package com.market.chat.controller;

import com.market.chat.infrastructure.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final DataSource dataSource;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final ConnectionRegistry registry;

    @Value("${chat.redis.enabled:false}")
    private boolean redisEnabled;

    public HealthController(DataSource dataSource,
                            ObjectProvider<StringRedisTemplate> redisTemplate,
                            ConnectionRegistry registry) {
        this.dataSource = dataSource;
        this.redisTemplate = redisTemplate;
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean healthy = true;

        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(2);
            response.put("database", valid ? "connected" : "disconnected");
            healthy = valid;
        } catch (Exception e) {
            log.warn("Health check: database unreachable: {}", e.getMessage());
            response.put("database", "disconnected");
            healthy = false;
        }

        if (redisEnabled) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            try {
                if (template == null || template.getConnectionFactory() == null) {
                    throw new IllegalStateException("no Redis connection factory");
                }
                template.getConnectionFactory().getConnection().ping();
                response.put("redis", "connected");
            } catch (Exception e) {
                log.warn("Health check: Redis unreachable: {}", e.getMessage());
                response.put("redis", "disconnected");
            }
        }

        response.put("activeConnections", registry.getActiveConnectionCount());
        response.put("status", healthy ? "healthy" : "unhealthy");
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("success", healthy, "data", response));
    }
}
