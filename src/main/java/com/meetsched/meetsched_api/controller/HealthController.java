package com.meetsched.meetsched_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.meetsched.meetsched_api.config.SchedulerProperties;

/**
 * Health check endpoint, also reporting the scheduler settings in effect.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final SchedulerProperties properties;

    public HealthController(SchedulerProperties properties) {
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "meetsched-api");

        Map<String, Object> scheduler = new HashMap<>();
        scheduler.put("hybridMaxRequests", properties.getHybrid().getMaxRequests());
        scheduler.put("hybridMaxHosts", properties.getHybrid().getMaxHosts());
        scheduler.put("hybridAcceptanceRatio", properties.getHybrid().getAcceptanceRatio());
        scheduler.put("annealingMaxIterations", properties.getAnnealing().getMaxIterations());
        scheduler.put("annealingSeeded", properties.getAnnealing().getSeed() != null);
        scheduler.put("defaultTimeoutMs", properties.getDefaultTimeout().toMillis());
        health.put("scheduler", scheduler);

        return ResponseEntity.ok(health);
    }
}
