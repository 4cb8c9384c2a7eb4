package com.example.leadintake.controller;

import com.example.leadintake.config.IntakeProperties;
import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.service.DispatchClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final DispatchClient dispatchClient;
    private final FallbackPolicy fallbackPolicy;
    private final IntakeProperties properties;

    public HealthController(DispatchClient dispatchClient, FallbackPolicy fallbackPolicy, IntakeProperties properties) {
        this.dispatchClient = dispatchClient;
        this.fallbackPolicy = fallbackPolicy;
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "lead-intake-mcp");
        health.put("version", "1.0.0");

        String token = properties.getInbox().getToken();
        health.put("inboxUrl", properties.getInbox().getUrl());
        health.put("inboxToken", token != null && !token.isBlank() ? "CONFIGURED" : "MISSING");

        // leads with gaps the policy cannot fill would be rejected
        if (fallbackPolicy.isComplete()) {
            health.put("fallbackPolicy", "COMPLETE");
        } else {
            health.put("fallbackPolicy", "INCOMPLETE");
            health.put("fallbackMissing", fallbackPolicy.uncoveredFields());
        }

        health.put("dispatch", dispatchClient.getStats());
        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
