package com.sensor.alerts.controller;

import com.sensor.alerts.config.AerospikeBackend;
import com.sensor.alerts.service.PushGatewayClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Status", description = "Liveness and runtime information")
public class ServiceStatusController {

    private static final String SERVICE_NAME = "Alert API Backend";

    private final PushGatewayClient pushGatewayClient;
    private final AerospikeBackend aerospikeBackend;

    @Value("${app.version:1.0.0}")
    private String version;

    @Value("${app.environment:development}")
    private String environment;

    public ServiceStatusController(PushGatewayClient pushGatewayClient, AerospikeBackend aerospikeBackend) {
        this.pushGatewayClient = pushGatewayClient;
        this.aerospikeBackend = aerospikeBackend;
    }

    @Operation(summary = "Service banner")
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.putAll(health().getBody());
        body.put("version", version);
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Health check",
            description = "Always healthy while the process is serving; reports which backends are degraded.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("pushGateway", pushGatewayClient.isInitialized());
        body.put("alertStore", aerospikeBackend.isAvailable());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Server stats")
    @GetMapping("/api/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("server", SERVICE_NAME);
        body.put("version", version);
        body.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        body.put("pushGateway", pushGatewayClient.isInitialized());
        body.put("alertStore", aerospikeBackend.isAvailable());
        body.put("environment", environment);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
