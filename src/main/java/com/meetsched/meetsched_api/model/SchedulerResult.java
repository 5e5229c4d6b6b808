package com.meetsched.meetsched_api.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SchedulerResult {
    private List<MeetingAssignment> assignments = new ArrayList<>();
    private List<UnscheduledRequest> unscheduled = new ArrayList<>();
    private SchedulerMetrics metrics = SchedulerMetrics.empty();
    private SchedulerAlgorithm algorithmUsed;
    private SchedulerAlgorithm requestedAlgorithm;
    private RunState runState;
    private boolean fallback;
    private long computationTimeMs;
    private String explanation;

    public SchedulerResult(List<MeetingAssignment> assignments, List<UnscheduledRequest> unscheduled,
                           SchedulerMetrics metrics, SchedulerAlgorithm algorithmUsed, String explanation) {
        this.assignments = assignments;
        this.unscheduled = unscheduled;
        this.metrics = metrics;
        this.algorithmUsed = algorithmUsed;
        this.explanation = explanation;
    }
}
