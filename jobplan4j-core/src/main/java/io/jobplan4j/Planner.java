package io.jobplan4j;

import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.solver.genetic.GeneticOptions;
import io.jobplan4j.solver.genetic.GeneticResult;

/**
 * Main scheduling API, bound to one {@link Problem}.
 *
 * <p>Offers three independent solvers:
 * <ul>
 *   <li>List scheduling: greedy, deterministic, one pass over the topological order</li>
 *   <li>Genetic optimization: population search over job orders, reproducible by seed</li>
 *   <li>Backtracking: exhaustive search over start times within a time horizon</li>
 * </ul>
 *
 * <p>If the dependencies contain a cycle, every entry point returns a
 * {@link io.jobplan4j.core.SolveStatus#CYCLE_DETECTED} result without running a solver.
 * Each call builds its own machine state, so one planner may run several solvers concurrently.
 */
public interface Planner {

    Problem problem();

    SolveResult runListSchedule();

    SolveResult runGenetic(int populationSize, int generations, double mutationRate, long seed);

    SolveResult runGenetic(GeneticOptions options);

    /**
     * Backtracking over the topological order; every job must end by {@code timeHorizon}.
     */
    SolveResult runBacktracking(long timeHorizon);

    /**
     * Full genetic result, including the best order and the best-seen makespan history.
     */
    GeneticResult optimize(GeneticOptions options) throws CycleDetectedException;
}
