package com.meetsched.meetsched_api.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Tuning knobs for the solvers and the hybrid selector, bound from {@code scheduler.*}.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private Hybrid hybrid = new Hybrid();
    private Annealing annealing = new Annealing();

    /** Nominal slots per host used as the utilization denominator. */
    private double utilizationSlotsPerHost = 4.0;

    /** Deadline applied to a run when the caller does not pass one. */
    private Duration defaultTimeout = Duration.ofSeconds(45);

    /** Alternative slots offered for each unscheduled request. */
    private int suggestionLimit = 3;

    @Data
    public static class Hybrid {
        private int maxRequests = 50;
        private int maxHosts = 10;
        /** Annealing result is kept when its scheduled share is strictly above this. */
        private double acceptanceRatio = 0.7;
    }

    @Data
    public static class Annealing {
        private double initialTemperature = 1000.0;
        private double coolingRate = 0.95;
        private double minTemperature = 1.0;
        private int maxIterations = 1000;
        /** Fixed seed for reproducible runs; unset means a fresh random source per run. */
        private Long seed;
    }
}
