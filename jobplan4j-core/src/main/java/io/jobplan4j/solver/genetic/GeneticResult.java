package io.jobplan4j.solver.genetic;

import io.jobplan4j.solver.Evaluation;

import java.util.List;

/**
 * Result of a genetic optimization run.
 *
 * bestOrder       : lowest-makespan individual of the final population
 * bestEvaluation  : its evaluation; infeasible if the whole final population was
 * bestSeenHistory : best makespan seen so far, one entry per evaluated population
 *                   (initial population first); non-increasing
 * interrupted     : the run stopped early on a thread interrupt
 */
public record GeneticResult(
        List<String> bestOrder,
        Evaluation bestEvaluation,
        List<Long> bestSeenHistory,
        boolean interrupted
) {
    public GeneticResult {
        bestOrder = List.copyOf(bestOrder);
        bestSeenHistory = List.copyOf(bestSeenHistory);
    }

    /**
     * False when every individual of the final population violated precedence.
     */
    public boolean feasible() {
        return bestEvaluation.feasible();
    }

    public long bestMakespan() {
        return bestEvaluation.fitness();
    }

    public long bestSeenMakespan() {
        return bestSeenHistory.isEmpty() ? Evaluation.INFEASIBLE_FITNESS : bestSeenHistory.get(bestSeenHistory.size() - 1);
    }
}
