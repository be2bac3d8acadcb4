package com.flagship.course_payments.health;

import com.flagship.course_payments.gateway.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain liveness/readiness endpoint. Unlike the Actuator health endpoint, this does not
 * require authorization. Gateway configuration is reported but does not make the service DOWN.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final GatewayProperties gatewayProperties;

    public HealthController(DataSource dataSource, GatewayProperties gatewayProperties) {
        this.dataSource = dataSource;
        this.gatewayProperties = gatewayProperties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("gatewayConfigured", gatewayProperties.isConfigured());
        response.put("webhookConfigured", gatewayProperties.isWebhookConfigured());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
