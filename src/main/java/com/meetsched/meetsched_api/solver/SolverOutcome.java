package com.meetsched.meetsched_api.solver;

import java.util.Optional;

/**
 * Either a solution or the reason a solver could not produce one.
 */
public final class SolverOutcome {

    private final ScheduleSolution solution;
    private final String failureReason;
    private final Throwable cause;

    private SolverOutcome(ScheduleSolution solution, String failureReason, Throwable cause) {
        this.solution = solution;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static SolverOutcome solved(ScheduleSolution solution) {
        return new SolverOutcome(solution, null, null);
    }

    public static SolverOutcome failed(String reason, Throwable cause) {
        return new SolverOutcome(null, reason, cause);
    }

    public boolean isSolved() {
        return solution != null;
    }

    public ScheduleSolution getSolution() {
        if (solution == null) {
            throw new IllegalStateException("Solver failed: " + failureReason);
        }
        return solution;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }
}
