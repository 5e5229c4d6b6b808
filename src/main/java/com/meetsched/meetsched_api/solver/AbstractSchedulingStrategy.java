package com.meetsched.meetsched_api.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns unexpected runtime failures inside {@link #doSolve} into a failed {@link SolverOutcome}.
 */
public abstract class AbstractSchedulingStrategy implements SchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSchedulingStrategy.class);

    @Override
    public final SolverOutcome solve(SchedulingProblem problem) {
        try {
            return SolverOutcome.solved(doSolve(problem));
        } catch (RuntimeException e) {
            logger.error("!!! {} solver failed: {}", algorithm().getValue(), e.getMessage(), e);
            return SolverOutcome.failed(algorithm().getValue() + " solver failed: " + e.getMessage(), e);
        }
    }

    protected abstract ScheduleSolution doSolve(SchedulingProblem problem);
}
