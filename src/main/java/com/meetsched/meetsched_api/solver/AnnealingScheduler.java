package com.meetsched.meetsched_api.solver;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.meetsched.meetsched_api.config.SchedulerProperties;
import com.meetsched.meetsched_api.model.MeetingAssignment;
import com.meetsched.meetsched_api.model.MeetingRequest;
import com.meetsched.meetsched_api.model.SchedulerAlgorithm;
import com.meetsched.meetsched_api.model.TimeSlot;
import com.meetsched.meetsched_api.model.UnscheduledRequest;

/**
 * Simulated annealing over the full request-to-slot mapping ("quantum-inspired" in the API,
 * but an ordinary sequential search). Intermediate states may double-book a slot; the best
 * mapping is repaired through a {@link HostScheduleTracker} before it is returned.
 */
@Component
public class AnnealingScheduler extends AbstractSchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AnnealingScheduler.class);

    static final int COLLISION_PENALTY = 100;
    static final int PREFERRED_DATE_BONUS = 15;
    static final String UNMAPPED_REASON = "no suitable slot found";

    private final SchedulerProperties properties;
    private final RandomSourceFactory randomSourceFactory;
    private final Clock clock;

    public AnnealingScheduler(SchedulerProperties properties, RandomSourceFactory randomSourceFactory, Clock clock) {
        this.properties = properties;
        this.randomSourceFactory = randomSourceFactory;
        this.clock = clock;
    }

    @Override
    public SchedulerAlgorithm algorithm() {
        return SchedulerAlgorithm.QUANTUM;
    }

    @Override
    protected ScheduleSolution doSolve(SchedulingProblem problem) {
        logger.info("Running quantum-inspired scheduler (simulated annealing) for {} requests",
                problem.getRequests().size());

        AvailabilityIndex index = AvailabilityIndex.build(problem.getHosts(), problem.getConstraints());
        AnnealingRun run = anneal(problem, index, randomSourceFactory.newSource());

        logger.info("Simulated annealing: {} iterations, best objective {}{}", run.getIterations(),
                run.getBestObjective(), run.isStoppedEarly() ? " (stopped at deadline)" : "");
        return toSolution(problem, index, run);
    }

    AnnealingRun anneal(SchedulingProblem problem, AvailabilityIndex index, Random random) {
        SchedulerProperties.Annealing config = properties.getAnnealing();
        List<MeetingRequest> requests = problem.getRequests();
        int[] candidates = index.handlesWithSlots();

        int[] currentHosts = new int[requests.size()];
        int[] currentSlots = new int[requests.size()];
        Arrays.fill(currentHosts, -1);
        Arrays.fill(currentSlots, -1);
        if (candidates.length > 0) {
            for (int i = 0; i < requests.size(); i++) {
                int handle = candidates[random.nextInt(candidates.length)];
                currentHosts[i] = handle;
                currentSlots[i] = random.nextInt(index.slots(handle).size());
            }
        }
        int currentObjective = objective(requests, index, currentHosts, currentSlots);

        int[] bestHosts = currentHosts.clone();
        int[] bestSlots = currentSlots.clone();
        int bestObjective = currentObjective;

        List<Integer> trajectory = new ArrayList<>();
        double temperature = config.getInitialTemperature();
        int iterations = 0;
        boolean stoppedEarly = false;
        boolean searchable = candidates.length > 0 && !requests.isEmpty();

        while (searchable && temperature > config.getMinTemperature() && iterations < config.getMaxIterations()) {
            if (problem.isPastDeadline(clock) || Thread.currentThread().isInterrupted()) {
                stoppedEarly = true;
                break;
            }

            int[] neighborHosts = currentHosts.clone();
            int[] neighborSlots = currentSlots.clone();
            int moved = random.nextInt(requests.size());
            int handle = candidates[random.nextInt(candidates.length)];
            neighborHosts[moved] = handle;
            neighborSlots[moved] = random.nextInt(index.slots(handle).size());

            int neighborObjective = objective(requests, index, neighborHosts, neighborSlots);
            int delta = neighborObjective - currentObjective;

            if (delta > 0 || random.nextDouble() < Math.exp(delta / temperature)) {
                currentHosts = neighborHosts;
                currentSlots = neighborSlots;
                currentObjective = neighborObjective;
                if (currentObjective > bestObjective) {
                    bestHosts = currentHosts.clone();
                    bestSlots = currentSlots.clone();
                    bestObjective = currentObjective;
                }
            }

            temperature *= config.getCoolingRate();
            iterations++;
            trajectory.add(bestObjective);
        }

        return new AnnealingRun(bestHosts, bestSlots, bestObjective, iterations, stoppedEarly, trajectory);
    }

    /**
     * Sum of importance plus preferred-date bonus over mapped requests. A request landing on a
     * (host, date, start) already taken earlier in request order scores -100 instead.
     */
    static int objective(List<MeetingRequest> requests, AvailabilityIndex index, int[] hostHandles, int[] slotIndexes) {
        int score = 0;
        Set<String> usedSlots = new HashSet<>();
        for (int i = 0; i < requests.size(); i++) {
            if (hostHandles[i] < 0) continue;
            TimeSlot slot = index.slots(hostHandles[i]).get(slotIndexes[i]);
            String key = slot.getHostId() + ":" + slot.getDate() + ":" + slot.getStartTime();
            if (!usedSlots.add(key)) {
                score -= COLLISION_PENALTY;
            } else {
                MeetingRequest request = requests.get(i);
                score += request.effectiveImportance();
                if (request.prefersDate(slot.getDate())) score += PREFERRED_DATE_BONUS;
            }
        }
        return score;
    }

    private ScheduleSolution toSolution(SchedulingProblem problem, AvailabilityIndex index, AnnealingRun run) {
        HostScheduleTracker tracker = new HostScheduleTracker(index, problem.getConstraints());
        List<TimeSlot> suggestions = index.suggestions(properties.getSuggestionLimit());
        List<MeetingAssignment> assignments = new ArrayList<>();
        List<UnscheduledRequest> unscheduled = new ArrayList<>();

        List<MeetingRequest> requests = problem.getRequests();
        for (int i = 0; i < requests.size(); i++) {
            MeetingRequest request = requests.get(i);
            int handle = run.hostHandle(i);
            if (handle < 0) {
                unscheduled.add(new UnscheduledRequest(request.getId(), UNMAPPED_REASON, suggestions));
                continue;
            }

            TimeSlot slot = index.slots(handle).get(run.slotIndex(i));
            PlacementCheck check = tracker.check(handle, slot);
            if (check != PlacementCheck.OK) {
                logger.debug("Dropping annealed placement of {} on {}: {}", request.getId(), slot, check);
                unscheduled.add(new UnscheduledRequest(request.getId(), check.getReason(), suggestions));
                continue;
            }

            tracker.commit(handle, slot);
            boolean preferredDate = request.prefersDate(slot.getDate());
            int score = request.effectiveImportance() + (preferredDate ? PREFERRED_DATE_BONUS : 0);
            String explanation = "Quantum-inspired assignment (importance: " + request.effectiveImportance()
                    + (preferredDate ? ", preferred date" : "") + ")";
            assignments.add(new MeetingAssignment(request.getId(), slot.getHostId(), slot, score, explanation));
        }

        return new ScheduleSolution(SchedulerAlgorithm.QUANTUM, assignments, unscheduled,
                "Simulated annealing optimization: " + run.getIterations() + " iterations, best objective "
                        + run.getBestObjective());
    }
}
