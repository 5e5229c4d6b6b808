package com.meetsched.meetsched_api.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.TimeSlot;
import com.meetsched.meetsched_api.solver.AvailabilityIndex;
import com.meetsched.meetsched_api.solver.FeasibilityChecker;
import com.meetsched.meetsched_api.solver.SchedulingProblem;

/**
 * Independent check of a finished schedule. Counts double bookings, daily cap overruns,
 * working-hour breaches and slots the host never offered. A correct solver scores zero.
 */
@Component
public class ScheduleVerifier {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleVerifier.class);

    public int countViolations(SchedulingProblem problem, List<MeetingAssignment> assignments) {
        SchedulerConstraints constraints = problem.getConstraints();
        AvailabilityIndex index = AvailabilityIndex.build(problem.getHosts(), constraints);
        int violations = 0;

        Map<String, List<MeetingAssignment>> byHost = assignments.stream()
                .collect(Collectors.groupingBy(MeetingAssignment::getHostId));

        for (Map.Entry<String, List<MeetingAssignment>> entry : byHost.entrySet()) {
            Integer handle = index.handleOf(entry.getKey());
            if (handle == null) {
                logger.error("!!! VALIDATION: Assignments reference unknown or inactive host {}", entry.getKey());
                violations += entry.getValue().size();
                continue;
            }
            Host host = index.host(handle);
            List<TimeSlot> offered = index.slots(handle);
            List<TimeSlot> slots = entry.getValue().stream()
                    .map(MeetingAssignment::getTimeSlot)
                    .collect(Collectors.toList());

            violations += countOverlaps(host.getId(), slots);
            violations += countCapOverruns(host, slots, constraints.getMaxMeetingsPerDay());
            for (TimeSlot slot : slots) {
                if (!FeasibilityChecker.withinWorkingHours(slot, constraints)) {
                    logger.error("!!! VALIDATION: {} is outside working hours", slot);
                    violations++;
                }
                if (!offered.contains(slot)) {
                    logger.error("!!! VALIDATION: {} is not offered by host {}", slot, host.getId());
                    violations++;
                }
            }
        }
        return violations;
    }

    private int countOverlaps(String hostId, List<TimeSlot> slots) {
        int overlaps = 0;
        List<TimeSlot> sorted = new ArrayList<>(slots);
        sorted.sort(Comparator.comparing(TimeSlot::getDate).thenComparing(TimeSlot::getStartTime));
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                if (!sorted.get(j).getDate().equals(sorted.get(i).getDate())) break;
                if (FeasibilityChecker.overlaps(sorted.get(i), sorted.get(j))) {
                    logger.error("!!! VALIDATION OVERLAP: host {} has {} and {}", hostId, sorted.get(i), sorted.get(j));
                    overlaps++;
                }
            }
        }
        return overlaps;
    }

    private int countCapOverruns(Host host, List<TimeSlot> slots, int globalMax) {
        int cap = host.effectiveMaxMeetingsPerDay(globalMax);
        Map<LocalDate, Integer> perDay = new HashMap<>();
        slots.forEach(slot -> perDay.merge(slot.getDate(), 1, Integer::sum));
        int overruns = 0;
        for (Map.Entry<LocalDate, Integer> day : perDay.entrySet()) {
            if (day.getValue() > cap) {
                logger.error("!!! VALIDATION: host {} has {} meetings on {} (limit {})",
                        host.getId(), day.getValue(), day.getKey(), cap);
                overruns += day.getValue() - cap;
            }
        }
        return overruns;
    }
}
