package com.meetsched.meetsched_api.solver;

import java.util.Collections;
import java.util.List;

/**
 * Best mapping found by one annealing search plus how the search went. Slot and host arrays
 * are indexed by request position; {@code -1} marks an unmapped request.
 */
public final class AnnealingRun {

    private final int[] hostHandles;
    private final int[] slotIndexes;
    private final int bestObjective;
    private final int iterations;
    private final boolean stoppedEarly;
    private final List<Integer> bestObjectiveTrajectory;

    AnnealingRun(int[] hostHandles, int[] slotIndexes, int bestObjective, int iterations,
                 boolean stoppedEarly, List<Integer> bestObjectiveTrajectory) {
        this.hostHandles = hostHandles;
        this.slotIndexes = slotIndexes;
        this.bestObjective = bestObjective;
        this.iterations = iterations;
        this.stoppedEarly = stoppedEarly;
        this.bestObjectiveTrajectory = Collections.unmodifiableList(bestObjectiveTrajectory);
    }

    public int hostHandle(int requestPosition) { return hostHandles[requestPosition]; }
    public int slotIndex(int requestPosition) { return slotIndexes[requestPosition]; }
    public int getBestObjective() { return bestObjective; }
    public int getIterations() { return iterations; }
    public boolean isStoppedEarly() { return stoppedEarly; }

    /** Best objective after each iteration; never decreases. */
    public List<Integer> getBestObjectiveTrajectory() { return bestObjectiveTrajectory; }
}
