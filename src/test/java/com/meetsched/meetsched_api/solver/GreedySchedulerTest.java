package com.meetsched.meetsched_api.solver;

import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY1;
import static com.meetsched.meetsched_api.support.SchedulingTestData.DAY2;
import static com.meetsched.meetsched_api.support.SchedulingTestData.assertInvariants;
import static com.meetsched.meetsched_api.support.SchedulingTestData.constraints;
import static com.meetsched.meetsched_api.support.SchedulingTestData.day;
import static com.meetsched.meetsched_api.support.SchedulingTestData.host;
import static com.meetsched.meetsched_api.support.SchedulingTestData.properties;
import static com.meetsched.meetsched_api.support.SchedulingTestData.randomProblem;
import static com.meetsched.meetsched_api.support.SchedulingTestData.request;
import static com.meetsched.meetsched_api.support.SchedulingTestData.schedulerRequest;
import static com.meetsched.meetsched_api.support.SchedulingTestData.slot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.MeetingRequest;
import com.meetsched.meetsched_api.model.SchedulerAlgorithm;
import com.meetsched.meetsched_api.model.SchedulerRequest;
import com.meetsched.meetsched_api.model.UnscheduledRequest;

class GreedySchedulerTest {

    private GreedyScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new GreedyScheduler(properties());
    }

    private ScheduleSolution solve(List<MeetingRequest> requests, List<Host> hosts) {
        SolverOutcome outcome = scheduler.solve(new SchedulingProblem(requests, hosts, constraints(), null));
        assertTrue(outcome.isSolved());
        return outcome.getSolution();
    }

    @Test
    void schedulesAllThreeRequestsInImportanceOrder() {
        List<MeetingRequest> requests = List.of(request("low", 50), request("top", 90), request("mid", 70));
        List<Host> hosts = List.of(
                host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30"))),
                host("h2", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30"))));

        ScheduleSolution solution = solve(requests, hosts);

        assertEquals(3, solution.getAssignments().size());
        assertTrue(solution.getUnscheduled().isEmpty());
        assertEquals(List.of("top", "mid", "low"),
                solution.getAssignments().stream().map(MeetingAssignment::getRequestId).toList());
        MeetingAssignment top = solution.getAssignments().get(0);
        assertEquals("h1", top.getHostId());
        assertEquals(LocalTime.of(9, 0), top.getTimeSlot().getStartTime());
        assertEquals(90.0, top.getScore());
    }

    @Test
    void competingRequestsForOneSlotLeaveOneUnscheduled() {
        List<MeetingRequest> requests = List.of(request("a", 60), request("b", 80));
        List<Host> hosts = List.of(host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30"))));

        ScheduleSolution solution = solve(requests, hosts);

        assertEquals(1, solution.getAssignments().size());
        assertEquals("b", solution.getAssignments().get(0).getRequestId());
        assertEquals(1, solution.getUnscheduled().size());
        UnscheduledRequest loser = solution.getUnscheduled().get(0);
        assertEquals("a", loser.getRequestId());
        assertEquals(GreedyScheduler.NO_SLOT_REASON, loser.getReason());
        // suggestions are not filtered against what was already booked
        assertEquals(List.of(solution.getAssignments().get(0).getTimeSlot()), loser.getAlternativeSuggestions());
    }

    @Test
    void equalImportanceKeepsInputOrder() {
        List<MeetingRequest> requests = List.of(request("first", 70), request("second", 70), request("third", null));
        List<Host> hosts = List.of(host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30"))));

        ScheduleSolution solution = solve(requests, hosts);

        assertEquals("first", solution.getAssignments().get(0).getRequestId());
        assertEquals("second", solution.getAssignments().get(1).getRequestId());
        assertEquals("third", solution.getUnscheduled().get(0).getRequestId());
    }

    @Test
    void repeatedRunsProduceIdenticalAssignments() {
        SchedulerRequest input = randomProblem(11L, SchedulerAlgorithm.CLASSICAL);

        ScheduleSolution first = solve(input.getRequests(), input.getHosts());
        ScheduleSolution second = solve(input.getRequests(), input.getHosts());

        assertEquals(first.getAssignments(), second.getAssignments());
        assertEquals(first.getUnscheduled(), second.getUnscheduled());
    }

    @Test
    void bonusesSteerTheChoiceAndAreExplainedInOrder() {
        MeetingRequest request = new MeetingRequest("r1", null, new ArrayList<>(List.of("Cloud Security")),
                new ArrayList<>(List.of(DAY2)), "partnership");
        Host generalist = host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30")), day(DAY2, slot(DAY2, "09:00", "09:30")));
        Host specialist = new Host("h2", "Bea", new ArrayList<>(List.of(
                day(DAY1, slot(DAY1, "09:00", "09:30")),
                day(DAY2, slot(DAY2, "11:00", "11:30")))), 4,
                new ArrayList<>(List.of("SECURITY")), new ArrayList<>(List.of("partnership")));

        MeetingAssignment assignment = solve(List.of(request), List.of(generalist, specialist)).getAssignments().get(0);

        assertEquals("h2", assignment.getHostId());
        assertEquals(DAY2, assignment.getTimeSlot().getDate());
        assertEquals(95.0, assignment.getScore());
        assertEquals("Assigned to Bea (Score: 95). Importance score: 50. Host expertise matches request topics. "
                + "Preferred date available. Host prefers this meeting type.", assignment.getExplanation());
    }

    @Test
    void firstEncounteredCandidateWinsATie() {
        List<Host> hosts = List.of(
                host("h1", 4, day(DAY1, slot(DAY1, "15:00", "15:30"))),
                host("h2", 4, day(DAY1, slot(DAY1, "09:00", "09:30"))));

        MeetingAssignment assignment = solve(List.of(request("r1", 40)), hosts).getAssignments().get(0);

        assertEquals("h1", assignment.getHostId());
    }

    @Test
    void hostDailyCapOverridesTheGlobalLimit() {
        Host capped = host("h1", 1, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30")),
                day(DAY2, slot(DAY2, "09:00", "09:30")));
        Host uncapped = host("h2", null, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30")));

        ScheduleSolution solution = solve(List.of(request("a", 90), request("b", 80), request("c", 70),
                request("d", 60), request("e", 50)), List.of(capped, uncapped));

        long cappedOnDay1 = solution.getAssignments().stream()
                .filter(a -> a.getHostId().equals("h1") && a.getTimeSlot().getDate().equals(DAY1))
                .count();
        assertEquals(1, cappedOnDay1);
        assertEquals(4, solution.getAssignments().size());
    }

    @Test
    void slotsOutsideWorkingHoursAreNeverUsed() {
        List<Host> hosts = List.of(host("h1", 4, day(DAY1, slot(DAY1, "07:30", "08:00"), slot(DAY1, "17:45", "18:15"))));

        ScheduleSolution solution = solve(List.of(request("r1", 90)), hosts);

        assertTrue(solution.getAssignments().isEmpty());
        assertEquals(2, solution.getUnscheduled().get(0).getAlternativeSuggestions().size());
    }

    @Test
    void overlappingOfferedSlotsAreNotBothBooked() {
        List<Host> hosts = List.of(host("h1", 4, day(DAY1, slot(DAY1, "09:00", "10:00"), slot(DAY1, "09:30", "10:30"),
                slot(DAY1, "10:00", "11:00"))));

        ScheduleSolution solution = solve(List.of(request("a", 90), request("b", 80), request("c", 70)), hosts);

        assertEquals(2, solution.getAssignments().size());
        assertEquals("c", solution.getUnscheduled().get(0).getRequestId());
    }

    @Test
    void overCapacityLeavesAtLeastTheExcessUnscheduled() {
        List<Host> hosts = List.of(
                host("h1", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30"))),
                host("h2", 4, day(DAY1, slot(DAY1, "09:00", "09:30"), slot(DAY1, "10:00", "10:30"))));
        List<MeetingRequest> requests = new ArrayList<>();
        for (int i = 0; i < 7; i++) requests.add(request("r" + i, 10 * i));

        ScheduleSolution solution = solve(requests, hosts);

        assertTrue(solution.getUnscheduled().size() >= 3);
        assertInvariants(schedulerRequest(requests, hosts, SchedulerAlgorithm.CLASSICAL),
                solution.getAssignments(), solution.getUnscheduled());
    }

    @Test
    void noHostsMeansEverythingUnscheduledWithoutFailure() {
        ScheduleSolution solution = solve(List.of(request("r1", 50), request("r2", 60)), List.of());

        assertTrue(solution.getAssignments().isEmpty());
        assertEquals(2, solution.getUnscheduled().size());
        assertTrue(solution.getUnscheduled().get(0).getAlternativeSuggestions().isEmpty());
    }

    @Test
    void randomProblemsRespectEveryInvariant() {
        for (long seed = 1; seed <= 40; seed++) {
            SchedulerRequest input = randomProblem(seed, SchedulerAlgorithm.CLASSICAL);
            ScheduleSolution solution = solve(input.getRequests(), input.getHosts());
            assertInvariants(input, solution.getAssignments(), solution.getUnscheduled());
        }
    }

    @Test
    void expertiseMatchesSubstringsEitherWay() {
        MeetingRequest request = new MeetingRequest("r1", 50, new ArrayList<>(List.of("AI")), new ArrayList<>(), "demo");
        Host host = new Host("h1", null, new ArrayList<>(), 4, new ArrayList<>(List.of("applied ai research")), new ArrayList<>());

        assertTrue(GreedyScheduler.matchesExpertise(request, host));
        host.setExpertise(new ArrayList<>(List.of("finance")));
        assertFalse(GreedyScheduler.matchesExpertise(request, host));
    }
}
