package com.meetsched.meetsched_api.solver;

import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY1;
import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY2;
import static com.meetsched.meetsched_api.support.SchedulingTestData.constraints;
import static com.meetsched.meetsched_api.support.SchedulingTestData.slot;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.meetsched.meetsched_api.model.TimeSlot;

class FeasibilityCheckerTest {

    @Test
    void overlappingIntervalsOnSameDateConflict() {
        assertTrue(FeasibilityChecker.overlaps(slot(DAY1, "09:00", "10:00"), slot(DAY1, "09:30", "10:30")));
        assertTrue(FeasibilityChecker.overlaps(slot(DAY1, "09:00", "12:00"), slot(DAY1, "10:00", "10:30")));
    }

    @Test
    void backToBackSlotsDoNotConflict() {
        assertFalse(FeasibilityChecker.overlaps(slot(DAY1, "09:00", "09:30"), slot(DAY1, "09:30", "10:00")));
        assertFalse(FeasibilityChecker.overlaps(slot(DAY1, "09:30", "10:00"), slot(DAY1, "09:00", "09:30")));
    }

    @Test
    void sameTimeOnDifferentDatesDoesNotConflict() {
        assertFalse(FeasibilityChecker.overlaps(slot(DAY1, "09:00", "10:00"), slot(DAY2, "09:00", "10:00")));
    }

    @Test
    void workingHoursAreInclusiveAtBothEnds() {
        assertTrue(FeasibilityChecker.withinWorkingHours(slot(DAY1, "09:00", "09:30"), constraints()));
        assertTrue(FeasibilityChecker.withinWorkingHours(slot(DAY1, "17:30", "18:00"), constraints()));
        assertFalse(FeasibilityChecker.withinWorkingHours(slot(DAY1, "08:45", "09:15"), constraints()));
        assertFalse(FeasibilityChecker.withinWorkingHours(slot(DAY1, "17:45", "18:15"), constraints()));
    }

    @Test
    void dailyCapCountsOnlyTheSameDate() {
        List<TimeSlot> committed = List.of(slot(DAY1, "09:00", "09:30"), slot(DAY2, "09:00", "09:30"));
        assertFalse(FeasibilityChecker.underDailyCap(1, DAY1, committed));
        assertTrue(FeasibilityChecker.underDailyCap(2, DAY1, committed));
        assertTrue(FeasibilityChecker.underDailyCap(1, DAY1.plusDays(5), committed));
    }
}
