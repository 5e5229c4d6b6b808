package com.meetsched.meetsched_api.solver;

import com.meetsched.meetsched_api.model.SchedulerAlgorithm;

/**
 * A solver that places meeting requests on host slots. Implementations report failure through
 * {@link SolverOutcome#failed} instead of throwing, so that the caller can decide on a fallback.
 * An out-of-process solver can plug in here without the core depending on its runtime.
 */
public interface SchedulingStrategy {

    SchedulerAlgorithm algorithm();

    SolverOutcome solve(SchedulingProblem problem);
}
