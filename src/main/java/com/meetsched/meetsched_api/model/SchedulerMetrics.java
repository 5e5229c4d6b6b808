package com.meetsched.meetsched_api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerMetrics {
    private int totalRequests;
    private int scheduledCount;
    private int unscheduledCount;
    private double totalImportanceScore;
    private double averageHostUtilization;
    private int constraintViolations;

    public static SchedulerMetrics empty() {
        return new SchedulerMetrics(0, 0, 0, 0.0, 0.0, 0);
    }

    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) scheduledCount / totalRequests;
    }
}
