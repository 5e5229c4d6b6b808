package com.meetsched.meetsched_api.solver;

import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY1;
import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY2;
import static com.meetsched.meetsched_api.support.SchedulingTestData.blockedDay;
import static com.meetsched.meetsched_api.support.SchedulingTestData.constraints;
import static com.meetsched.meetsched_api.support.SchedulingTestData.day;
import static com.meetsched.meetsched_api.support.SchedulingTestData.host;
import static com.meetsched.meetsched_api.support.SchedulingTestData.request;
import static com.meetsched.meetsched_api.support.SchedulingTestData.slot;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalTime;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.TimeSlot;

class AvailabilityIndexTest {

    @Test
    void blockedDaysContributeNoSlots() {
        Host host = host("h1", 4,
                day(DAY1, slot(DAY1, "09:00", "09:30")),
                blockedDay(DAY2, slot(DAY2, "09:00", "09:30"), slot(DAY2, "10:00", "10:30")));

        AvailabilityIndex index = AvailabilityIndex.build(List.of(host), constraints());

        assertEquals(1, index.slots(0).size());
        assertEquals(DAY1, index.slots(0).get(0).getDate());
    }

    @Test
    void slotsAreStampedWithHostAndKeepInputOrder() {
        Host host = host("h1", 4,
                day(DAY2, slot(DAY2, "11:00", "11:30"), slot(DAY2, "09:00", "09:30")),
                day(DAY1, slot(DAY1, "14:00", "14:30")));

        List<TimeSlot> slots = AvailabilityIndex.build(List.of(host), constraints()).slots(0);

        assertEquals(List.of(
                new TimeSlot(DAY2, LocalTime.of(11, 0), LocalTime.of(11, 30), "h1"),
                new TimeSlot(DAY2, LocalTime.of(9, 0), LocalTime.of(9, 30), "h1"),
                new TimeSlot(DAY1, LocalTime.of(14, 0), LocalTime.of(14, 30), "h1")), slots);
        assertNull(host.getAvailability().get(0).getTimeSlots().get(0).getHostId(), "input left untouched");
    }

    @Test
    void slotListedUnderAnotherDayIsNotOffered() {
        Host host = host("h1", 4,
                day(DAY1, slot(DAY2, "09:00", "09:30"), slot(DAY1, "10:00", "10:30")),
                blockedDay(DAY2));

        List<TimeSlot> slots = AvailabilityIndex.build(List.of(host), constraints()).slots(0);

        assertEquals(List.of(new TimeSlot(DAY1, LocalTime.of(10, 0), LocalTime.of(10, 30), "h1")), slots);
    }

    @Test
    void undatedSlotInheritsAvailabilityDate() {
        TimeSlot undated = new TimeSlot(null, LocalTime.of(9, 0), LocalTime.of(9, 30));
        Host host = host("h1", 4, day(DAY1, undated));

        assertEquals(DAY1, AvailabilityIndex.build(List.of(host), constraints()).slots(0).get(0).getDate());
    }

    @Test
    void daysOutsideTheEventWindowAreIgnored() {
        Host host = host("h1", 4,
                day(DAY1.minusDays(1), slot(DAY1.minusDays(1), "09:00", "09:30")),
                day(DAY1, slot(DAY1, "09:00", "09:30")),
                day(DAY1.plusDays(10), slot(DAY1.plusDays(10), "09:00", "09:30")));

        AvailabilityIndex index = AvailabilityIndex.build(List.of(host), constraints());

        assertEquals(1, index.totalSlots());
    }

    @Test
    void inactiveHostsAreLeftOutOfTheProblem() {
        Host active = host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30")));
        Host inactive = host("h2", 4, day(DAY1, slot(DAY1, "09:00", "09:30")));
        inactive.setActive(false);

        SchedulingProblem problem = new SchedulingProblem(List.of(request("r1", 50)),
                List.of(inactive, active), constraints(), null);
        AvailabilityIndex index = AvailabilityIndex.build(problem.getHosts(), problem.getConstraints());

        assertEquals(1, index.hostCount());
        assertEquals(0, index.handleOf("h1"));
        assertNull(index.handleOf("h2"));
    }

    @Test
    void suggestionsStopAtTheLimitAndSpanHosts() {
        Host first = host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30")));
        Host empty = host("h2", 4);
        Host third = host("h3", 4, day(DAY1, slot(DAY1, "11:00", "11:30"), slot(DAY1, "12:00", "12:30")));

        AvailabilityIndex index = AvailabilityIndex.build(List.of(first, empty, third), constraints());
        List<TimeSlot> suggestions = index.suggestions(3);

        assertEquals(3, suggestions.size());
        assertEquals("h3", suggestions.get(2).getHostId());
        assertArrayEquals(new int[] {0, 2}, index.handlesWithSlots());
        assertTrue(index.suggestions(0).isEmpty());
    }
}
