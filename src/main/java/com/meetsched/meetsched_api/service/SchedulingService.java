package com.meetsched.meetsched_api.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import com.meetsched.meetsched_api.config.SchedulerProperties;
import com.meetsched.meetsched_api.exception.SchedulingException;
import com.meetsched.meetsched_api.model.RunState;
import com.meetsched.meetsched_api.model.SchedulerAlgorithm;
import com.meetsched.meetsched_api.model.SchedulerRequest;
import com.meetsched.meetsched_api.model.SchedulerResult;
import com.meetsched.meetsched_api.solver.SchedulingProblem;
import com.meetsched.meetsched_api.solver.SchedulingStrategy;
import com.meetsched.meetsched_api.solver.SolverOutcome;

/**
 * Picks and runs a solver for each scheduling request. A failed solver outcome is answered
 * with exactly one classical run; errors from the selected solver never reach the caller.
 */
@Service
public class SchedulingService {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingService.class);

    static final String FALLBACK_PREFIX = "Fallback to classical algorithm due to error";

    private final SchedulingStrategy classicalStrategy;
    private final SchedulingStrategy annealingStrategy;
    private final ConstraintsValidator validator;
    private final ScheduleResultBuilder resultBuilder;
    private final SchedulerProperties properties;
    private final Clock clock;

    public SchedulingService(@Qualifier("greedyScheduler") SchedulingStrategy classicalStrategy,
                             @Qualifier("annealingScheduler") SchedulingStrategy annealingStrategy,
                             ConstraintsValidator validator,
                             ScheduleResultBuilder resultBuilder,
                             SchedulerProperties properties,
                             Clock clock) {
        this.classicalStrategy = classicalStrategy;
        this.annealingStrategy = annealingStrategy;
        this.validator = validator;
        this.resultBuilder = resultBuilder;
        this.properties = properties;
        this.clock = clock;
    }

    public SchedulerResult optimize(SchedulerRequest request) {
        return optimize(request, null);
    }

    /**
     * @param timeout wall-clock budget for the run, or {@code null} for the configured default
     * @throws com.meetsched.meetsched_api.exception.InvalidConstraintsException on malformed input
     */
    public SchedulerResult optimize(SchedulerRequest request, Duration timeout) {
        validator.validate(request);

        SchedulerAlgorithm requested = request.effectiveAlgorithm();
        Instant deadline = clock.instant().plus(timeout != null ? timeout : properties.getDefaultTimeout());
        SchedulingProblem problem = SchedulingProblem.of(request, deadline);

        logger.info("Run {}: algorithm={}, requests={}, active hosts={}", RunState.DISPATCHED,
                requested.getValue(), problem.getRequests().size(), problem.getHosts().size());

        StopWatch stopWatch = new StopWatch("schedule-" + requested.getValue());
        stopWatch.start();
        logger.debug("Run {}", RunState.SOLVING);

        SchedulerResult result;
        switch (requested) {
            case CLASSICAL:
                result = runSingle(problem, classicalStrategy);
                break;
            case QUANTUM:
                result = runSingle(problem, annealingStrategy);
                break;
            case HYBRID:
            default:
                result = runHybrid(problem);
                break;
        }

        stopWatch.stop();
        result.setRequestedAlgorithm(requested);
        result.setComputationTimeMs(stopWatch.getTotalTimeMillis());

        logger.info("Run {}: {} assigned, {} unscheduled, algorithm used={}, {} ms", result.getRunState(),
                result.getAssignments().size(), result.getUnscheduled().size(),
                result.getAlgorithmUsed().getValue(), result.getComputationTimeMs());
        return result;
    }

    private SchedulerResult runSingle(SchedulingProblem problem, SchedulingStrategy strategy) {
        SolverOutcome outcome = strategy.solve(problem);
        if (!outcome.isSolved()) {
            return fallback(problem, outcome);
        }
        return succeeded(resultBuilder.build(problem, outcome.getSolution()));
    }

    private SchedulerResult runHybrid(SchedulingProblem problem) {
        SchedulerProperties.Hybrid hybrid = properties.getHybrid();
        int requestCount = problem.getRequests().size();
        boolean smallProblem = requestCount <= hybrid.getMaxRequests()
                && problem.getHosts().size() <= hybrid.getMaxHosts();

        String reason = "problem size";
        if (smallProblem) {
            SolverOutcome annealed = annealingStrategy.solve(problem);
            if (!annealed.isSolved()) {
                return fallback(problem, annealed);
            }
            SchedulerResult candidate = resultBuilder.build(problem, annealed.getSolution());
            int scheduled = candidate.getMetrics().getScheduledCount();
            if (candidate.getMetrics().successRate() > hybrid.getAcceptanceRatio()) {
                candidate.setExplanation("Hybrid: quantum-inspired solution accepted (" + scheduled + "/"
                        + requestCount + " scheduled). " + candidate.getExplanation());
                return succeeded(candidate);
            }
            logger.info("Hybrid: quantum-inspired solution scheduled only {}/{}, running classical",
                    scheduled, requestCount);
            reason = "quantum-inspired scheduled only " + scheduled + "/" + requestCount;
        }

        SolverOutcome greedy = classicalStrategy.solve(problem);
        if (!greedy.isSolved()) {
            return fallback(problem, greedy);
        }
        SchedulerResult result = resultBuilder.build(problem, greedy.getSolution());
        result.setExplanation("Hybrid: classical solution (" + reason + "). " + result.getExplanation());
        return succeeded(result);
    }

    private SchedulerResult fallback(SchedulingProblem problem, SolverOutcome failed) {
        logger.warn("!!! Solver failure, falling back to classical: {}", failed.getFailureReason());
        SolverOutcome classical = classicalStrategy.solve(problem);
        if (!classical.isSolved()) {
            throw new SchedulingException("Classical fallback failed: " + classical.getFailureReason(),
                    classical.getCause().orElse(null));
        }
        SchedulerResult result = resultBuilder.build(problem, classical.getSolution());
        result.setRunState(RunState.FAILED_FALLBACK);
        result.setFallback(true);
        result.setExplanation(FALLBACK_PREFIX + " (" + failed.getFailureReason() + "). " + result.getExplanation());
        return result;
    }

    private SchedulerResult succeeded(SchedulerResult result) {
        result.setRunState(RunState.SUCCEEDED);
        return result;
    }
}
