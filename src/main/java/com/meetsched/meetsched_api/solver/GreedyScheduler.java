package com.meetsched.meetsched_api.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.meetsched.meetsched_api.config.SchedulerProperties;
import com.meetsched.meetsched_api.model.Host;
import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.MeetingRequest;
import com.meetsched.meetsched_api.model.SchedulerAlgorithm;
import com.meetsched.meetsched_api.model.TimeSlot;
import com.meetsched.meetsched_api.model.UnscheduledRequest;

/**
 * Deterministic single pass: requests in descending importance (input order on ties), each
 * placed on the feasible host slot with the highest desirability. The first candidate found
 * wins a tie, scanning hosts, then availability days, then slots in input order.
 */
@Component
public class GreedyScheduler extends AbstractSchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(GreedyScheduler.class);

    static final String NO_SLOT_REASON = "no available time slot matches constraints";
    static final int EXPERTISE_BONUS = 20;
    static final int PREFERRED_DATE_BONUS = 15;
    static final int PREFERRED_TYPE_BONUS = 10;

    private final SchedulerProperties properties;

    public GreedyScheduler(SchedulerProperties properties) {
        this.properties = properties;
    }

    @Override
    public SchedulerAlgorithm algorithm() {
        return SchedulerAlgorithm.CLASSICAL;
    }

    @Override
    protected ScheduleSolution doSolve(SchedulingProblem problem) {
        logger.info("Running classical scheduler for {} requests across {} hosts",
                problem.getRequests().size(), problem.getHosts().size());

        AvailabilityIndex index = AvailabilityIndex.build(problem.getHosts(), problem.getConstraints());
        HostScheduleTracker tracker = new HostScheduleTracker(index, problem.getConstraints());

        // List.sort is stable, so equal scores keep their input order
        List<MeetingRequest> ordered = new ArrayList<>(problem.getRequests());
        ordered.sort(Comparator.comparingInt(MeetingRequest::effectiveImportance).reversed());

        List<MeetingAssignment> assignments = new ArrayList<>();
        List<UnscheduledRequest> unscheduled = new ArrayList<>();

        for (MeetingRequest request : ordered) {
            Candidate best = findBestCandidate(request, index, tracker);
            if (best != null) {
                tracker.commit(best.handle, best.slot);
                assignments.add(new MeetingAssignment(request.getId(), best.slot.getHostId(), best.slot,
                        best.score, explain(request, index.host(best.handle), best)));
            } else {
                logger.debug("No feasible slot for request {}", request.getId());
                unscheduled.add(new UnscheduledRequest(request.getId(), NO_SLOT_REASON,
                        index.suggestions(properties.getSuggestionLimit())));
            }
        }

        logger.info("Classical scheduler placed {}/{} requests", assignments.size(), ordered.size());
        return new ScheduleSolution(SchedulerAlgorithm.CLASSICAL, assignments, unscheduled,
                "Greedy algorithm: Assigned " + assignments.size() + "/" + ordered.size() + " meetings");
    }

    private Candidate findBestCandidate(MeetingRequest request, AvailabilityIndex index, HostScheduleTracker tracker) {
        Candidate best = null;
        for (int handle = 0; handle < index.hostCount(); handle++) {
            Host host = index.host(handle);
            boolean expertiseMatch = matchesExpertise(request, host);
            boolean typeMatch = prefersMeetingType(request, host);

            for (TimeSlot slot : index.slots(handle)) {
                if (tracker.check(handle, slot) != PlacementCheck.OK) continue;

                boolean preferredDate = request.prefersDate(slot.getDate());
                int score = request.effectiveImportance()
                        + (expertiseMatch ? EXPERTISE_BONUS : 0)
                        + (preferredDate ? PREFERRED_DATE_BONUS : 0)
                        + (typeMatch ? PREFERRED_TYPE_BONUS : 0);

                if (best == null || score > best.score) {
                    best = new Candidate(handle, slot, score, expertiseMatch, preferredDate, typeMatch);
                }
            }
        }
        return best;
    }

    /**
     * Case-insensitive substring match in either direction between any topic and any expertise tag.
     */
    static boolean matchesExpertise(MeetingRequest request, Host host) {
        if (request.getRequestedTopics() == null || host.getExpertise() == null) return false;
        for (String topic : request.getRequestedTopics()) {
            if (topic == null) continue;
            String t = topic.toLowerCase(Locale.ROOT);
            for (String expertise : host.getExpertise()) {
                if (expertise == null) continue;
                String e = expertise.toLowerCase(Locale.ROOT);
                if (t.contains(e) || e.contains(t)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean prefersMeetingType(MeetingRequest request, Host host) {
        return request.getMeetingType() != null
                && host.getPreferredMeetingTypes() != null
                && host.getPreferredMeetingTypes().contains(request.getMeetingType());
    }

    private String explain(MeetingRequest request, Host host, Candidate candidate) {
        List<String> reasons = new ArrayList<>();
        reasons.add("Importance score: " + request.effectiveImportance());
        if (candidate.expertiseMatch) reasons.add("Host expertise matches request topics");
        if (candidate.preferredDate) reasons.add("Preferred date available");
        if (candidate.typeMatch) reasons.add("Host prefers this meeting type");
        return "Assigned to " + host.getDisplayName() + " (Score: " + candidate.score + "). "
                + String.join(". ", reasons) + ".";
    }

    private static final class Candidate {
        final int handle;
        final TimeSlot slot;
        final int score;
        final boolean expertiseMatch;
        final boolean preferredDate;
        final boolean typeMatch;

        Candidate(int handle, TimeSlot slot, int score, boolean expertiseMatch, boolean preferredDate, boolean typeMatch) {
            this.handle = handle;
            this.slot = slot;
            this.score = score;
            this.expertiseMatch = expertiseMatch;
            this.preferredDate = preferredDate;
            this.typeMatch = typeMatch;
        }
    }
}
