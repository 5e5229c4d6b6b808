package com.meetsched.meetsched_api.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.TimeSlot;

/**
 * Slots committed so far in one run, kept per host handle of an {@link AvailabilityIndex}.
 * Created fresh for every run.
 */
public final class HostScheduleTracker {

    private final AvailabilityIndex index;
    private final SchedulerConstraints constraints;
    private final List<List<TimeSlot>> committed;

    public HostScheduleTracker(AvailabilityIndex index, SchedulerConstraints constraints) {
        this.index = index;
        this.constraints = constraints;
        this.committed = new ArrayList<>(index.hostCount());
        for (int handle = 0; handle < index.hostCount(); handle++) {
            committed.add(new ArrayList<>());
        }
    }

    public PlacementCheck check(int handle, TimeSlot slot) {
        List<TimeSlot> hostSlots = committed.get(handle);
        for (TimeSlot existing : hostSlots) {
            if (FeasibilityChecker.overlaps(existing, slot)) {
                return PlacementCheck.OVERLAP;
            }
        }
        if (!FeasibilityChecker.withinWorkingHours(slot, constraints)) {
            return PlacementCheck.OUTSIDE_WORKING_HOURS;
        }
        int cap = index.host(handle).effectiveMaxMeetingsPerDay(constraints.getMaxMeetingsPerDay());
        if (!FeasibilityChecker.underDailyCap(cap, slot.getDate(), hostSlots)) {
            return PlacementCheck.DAILY_CAP_REACHED;
        }
        return PlacementCheck.OK;
    }

    public void commit(int handle, TimeSlot slot) {
        committed.get(handle).add(slot);
    }

    public List<TimeSlot> committed(int handle) {
        return Collections.unmodifiableList(committed.get(handle));
    }
}
