package com.meetsched.meetsched_api.service;

import org.springframework.stereotype.Component;

import com.meetsched.meetsched_api.config.SchedulerProperties;
import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.SchedulerMetrics;
import com.meetsched.meetsched_api.model.SchedulerResult;
import com.meetsched.meetsched_api.solver.ScheduleSolution;
import com.meetsched.meetsched_api.solver.SchedulingProblem;

/**
 * Packs a solver's raw solution into the caller-facing result with aggregate metrics.
 */
@Component
public class ScheduleResultBuilder {

    private final SchedulerProperties properties;
    private final ScheduleVerifier verifier;

    public ScheduleResultBuilder(SchedulerProperties properties, ScheduleVerifier verifier) {
        this.properties = properties;
        this.verifier = verifier;
    }

    public SchedulerResult build(SchedulingProblem problem, ScheduleSolution solution) {
        SchedulerMetrics metrics = metrics(problem, solution);
        return new SchedulerResult(solution.getAssignments(), solution.getUnscheduled(), metrics,
                solution.getAlgorithm(), solution.getSummary());
    }

    SchedulerMetrics metrics(SchedulingProblem problem, ScheduleSolution solution) {
        int total = problem.getRequests().size();
        int scheduled = solution.getAssignments().size();
        double totalScore = solution.getAssignments().stream().mapToDouble(MeetingAssignment::getScore).sum();

        // Nominal denominator; hosts' real slot counts are not used here.
        double capacity = problem.getHosts().size() * properties.getUtilizationSlotsPerHost();
        double utilization = capacity > 0 ? scheduled / capacity : 0.0;

        int violations = verifier.countViolations(problem, solution.getAssignments());
        return new SchedulerMetrics(total, scheduled, solution.getUnscheduled().size(), totalScore, utilization, violations);
    }
}
