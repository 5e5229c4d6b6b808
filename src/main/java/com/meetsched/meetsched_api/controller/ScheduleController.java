package com.meetsched.meetsched_api.controller;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.meetsched.meetsched_api.model.SchedulerRequest;
import com.meetsched.meetsched_api.model.SchedulerResult;
import com.meetsched.meetsched_api.service.SchedulingService;

/**
 * Stateless entry point: the caller sends requests, hosts and constraints and gets the
 * schedule back. Nothing is stored.
 */
@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final SchedulingService schedulingService;

    public ScheduleController(SchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    @PostMapping("/optimize")
    public ResponseEntity<?> optimize(@RequestBody SchedulerRequest request,
                                      @RequestParam(name = "timeoutMs", required = false) Long timeoutMs) {
        logger.info(">>> Received /optimize request.");
        if (timeoutMs != null && timeoutMs <= 0) {
            logger.warn(">>> Rejecting non-positive timeoutMs {}", timeoutMs);
            return ResponseEntity.badRequest().body(Map.of("message", "timeoutMs must be positive."));
        }

        Duration timeout = timeoutMs != null ? Duration.ofMillis(timeoutMs) : null;
        SchedulerResult result = schedulingService.optimize(request, timeout);
        logger.info(">>> /optimize finished: {} scheduled, {} unscheduled",
                result.getMetrics().getScheduledCount(), result.getMetrics().getUnscheduledCount());
        return ResponseEntity.ok(result);
    }
}
