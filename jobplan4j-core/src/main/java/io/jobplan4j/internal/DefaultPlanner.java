package io.jobplan4j.internal;

import io.jobplan4j.Planner;
import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.graph.DependencyGraph;
import io.jobplan4j.solver.BacktrackingSolver;
import io.jobplan4j.solver.ListScheduler;
import io.jobplan4j.solver.ScheduleEvaluator;
import io.jobplan4j.solver.genetic.GeneticOptimizer;
import io.jobplan4j.solver.genetic.GeneticOptions;
import io.jobplan4j.solver.genetic.GeneticResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link Planner}: builds the dependency graph once and hands it to each solver.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Problem problem = Problem.builder()
 *         .machine("A", 100).machine("B", 100)
 *         .job("1", 5, "A")
 *         .job("2", 6, "A", "B")
 *         .dependency("1", "2")
 *         .build();
 *
 * Planner planner = new DefaultPlanner(problem);
 * SolveResult list = planner.runListSchedule();
 * SolveResult ga = planner.runGenetic(50, 100, 0.1, 42L);
 * SolveResult exact = planner.runBacktracking(100);
 * }</pre>
 */
public class DefaultPlanner implements Planner {
    private static final Logger log = LoggerFactory.getLogger(DefaultPlanner.class);

    private final Problem problem;
    private final PrecedenceRule rule;
    private final DependencyGraph graph;

    public DefaultPlanner(Problem problem) {
        this(problem, PrecedenceRule.COMPLETION);
    }

    public DefaultPlanner(Problem problem, PrecedenceRule rule) {
        this.problem = Objects.requireNonNull(problem, "problem must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.graph = DependencyGraph.build(problem);
    }

    @Override
    public Problem problem() {
        return problem;
    }

    @Override
    public SolveResult runListSchedule() {
        log.info("List scheduling starting problem={} rule={}", problem, rule);
        try {
            graph.topologicalOrder();
        } catch (CycleDetectedException e) {
            return cycle(e);
        }
        return new ListScheduler(rule).schedule(problem, graph);
    }

    @Override
    public SolveResult runGenetic(int populationSize, int generations, double mutationRate, long seed) {
        return runGenetic(new GeneticOptions(populationSize, generations, mutationRate, seed));
    }

    @Override
    public SolveResult runGenetic(GeneticOptions options) {
        GeneticResult result;
        try {
            result = optimize(options);
        } catch (CycleDetectedException e) {
            return cycle(e);
        }

        if (result.interrupted()) {
            return SolveResult.timeout("Genetic optimization interrupted after "
                    + (result.bestSeenHistory().size() - 1) + " of " + options.generations() + " generations");
        }
        if (!result.feasible()) {
            return SolveResult.allCandidatesInfeasible(
                    "Every individual of the final population violates precedence, populationSize="
                            + options.populationSize());
        }
        ScheduleEvaluator evaluator = new ScheduleEvaluator(problem, graph, rule);
        return SolveResult.solved(evaluator.toSchedule(result.bestEvaluation()));
    }

    @Override
    public GeneticResult optimize(GeneticOptions options) throws CycleDetectedException {
        Objects.requireNonNull(options, "options must not be null");
        graph.topologicalOrder();
        return new GeneticOptimizer(options).optimize(problem, graph, rule);
    }

    @Override
    public SolveResult runBacktracking(long timeHorizon) {
        BacktrackingSolver solver = new BacktrackingSolver(timeHorizon);
        List<String> order;
        try {
            order = graph.topologicalOrder();
        } catch (CycleDetectedException e) {
            return cycle(e);
        }
        log.info("Backtracking starting problem={} timeHorizon={}", problem, timeHorizon);
        return solver.solve(problem, graph, order);
    }

    public PrecedenceRule rule() {
        return rule;
    }

    private SolveResult cycle(CycleDetectedException e) {
        log.warn("Scheduling refused, dependency graph has a cycle msg={}", e.getMessage());
        return SolveResult.cycleDetected(e.getMessage());
    }
}
