package io.jobplan4j.solver;

import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.Schedule;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One-shot greedy list scheduler.
 *
 * <p>Places jobs in topological order, each at the earliest time its machines allow.
 * Deterministic and O(jobs x machines per job), but not optimal: the makespan depends on
 * the topological tie-break.
 */
public class ListScheduler {
    private static final Logger log = LoggerFactory.getLogger(ListScheduler.class);

    private final PrecedenceRule rule;

    public ListScheduler(PrecedenceRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
    }

    public SolveResult schedule(Problem problem) {
        Objects.requireNonNull(problem, "problem must not be null");
        return schedule(problem, DependencyGraph.build(problem));
    }

    public SolveResult schedule(Problem problem, DependencyGraph graph) {
        List<String> order;
        try {
            order = graph.topologicalOrder();
        } catch (CycleDetectedException e) {
            log.warn("List scheduling skipped, no valid order msg={}", e.getMessage());
            return SolveResult.noValidOrder(e.getMessage());
        }

        ScheduleEvaluator evaluator = new ScheduleEvaluator(problem, graph, rule);
        Evaluation evaluation = evaluator.evaluate(order);
        Schedule schedule = evaluator.toSchedule(evaluation);

        log.debug("List schedule computed jobs={} makespan={} rule={}", schedule.size(), schedule.makespan(), rule);
        return SolveResult.solved(schedule);
    }
}
