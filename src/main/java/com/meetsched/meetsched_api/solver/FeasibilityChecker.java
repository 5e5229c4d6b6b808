package com.meetsched.meetsched_api.solver;

import java.time.LocalDate;
import java.util.List;

import com.meetsched.meetsched_api.model.SchedulerConstraints;
import com.meetsched.meetsched_api.model.TimeSlot;

public final class FeasibilityChecker {

    private FeasibilityChecker() {}

    /**
     * Same date and the half-open intervals [start, end) intersect.
     */
    public static boolean overlaps(TimeSlot a, TimeSlot b) {
        if (a.getDate() == null || !a.getDate().equals(b.getDate())) return false;
        return !(a.endMinutes() <= b.startMinutes() || b.endMinutes() <= a.startMinutes());
    }

    public static boolean withinWorkingHours(TimeSlot slot, SchedulerConstraints constraints) {
        int workStart = constraints.getWorkingHoursStart().getHour() * 60 + constraints.getWorkingHoursStart().getMinute();
        int workEnd = constraints.getWorkingHoursEnd().getHour() * 60 + constraints.getWorkingHoursEnd().getMinute();
        return slot.startMinutes() >= workStart && slot.endMinutes() <= workEnd;
    }

    public static boolean underDailyCap(int maxMeetingsPerDay, LocalDate date, List<TimeSlot> committedForHost) {
        long onDate = committedForHost.stream().filter(s -> date.equals(s.getDate())).count();
        return onDate < maxMeetingsPerDay;
    }
}
