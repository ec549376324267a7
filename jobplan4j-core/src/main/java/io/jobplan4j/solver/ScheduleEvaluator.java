package io.jobplan4j.solver;

import io.jobplan4j.core.Job;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.Schedule;
import io.jobplan4j.core.ScheduledJob;
import io.jobplan4j.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Replays a job order against per-machine "next free" times.
 *
 * <p>Each job starts when all of its machines are free (and, under
 * {@link PrecedenceRule#COMPLETION}, when all of its predecessors have ended); its machines are
 * then busy until start + processing time. An order that places a job before one of its
 * predecessors is infeasible.
 *
 * <p>Machine state is local to each {@link #evaluate(List)} call, so one evaluator may be
 * used for any number of orders, also from several threads.
 */
public class ScheduleEvaluator {

    private final Problem problem;
    private final DependencyGraph graph;
    private final PrecedenceRule rule;

    public ScheduleEvaluator(Problem problem, DependencyGraph graph, PrecedenceRule rule) {
        this.problem = Objects.requireNonNull(problem, "problem must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
    }

    /**
     * @param order a permutation of all job ids
     * @throws IllegalArgumentException if {@code order} is not a permutation of the job ids
     */
    public Evaluation evaluate(List<String> order) {
        requirePermutation(order);

        Map<String, Long> machineFree = new HashMap<>();
        for (String machineId : problem.machineIds()) {
            machineFree.put(machineId, 0L);
        }
        Map<String, Long> starts = new LinkedHashMap<>();
        Map<String, Long> ends = new HashMap<>();

        for (String jobId : order) {
            Job job = problem.job(jobId);

            long start = 0;
            for (String p : graph.predecessors(jobId)) {
                Long predEnd = ends.get(p);
                if (predEnd == null) {
                    return Evaluation.infeasible(order, "job " + jobId + " placed before predecessor " + p);
                }
                if (rule.waitsForCompletion()) {
                    start = Math.max(start, predEnd);
                }
            }
            for (String m : job.requiredMachines()) {
                start = Math.max(start, machineFree.get(m));
            }

            long end = start + job.processingTime();
            for (String m : job.requiredMachines()) {
                machineFree.put(m, end);
            }
            starts.put(jobId, start);
            ends.put(jobId, end);
        }

        long makespan = 0;
        for (long free : machineFree.values()) {
            makespan = Math.max(makespan, free);
        }
        return Evaluation.feasible(order, starts, makespan);
    }

    /**
     * Convert a feasible evaluation into a schedule.
     */
    public Schedule toSchedule(Evaluation evaluation) {
        Objects.requireNonNull(evaluation, "evaluation must not be null");
        if (!evaluation.feasible()) {
            throw new IllegalArgumentException("Cannot build a schedule from an infeasible order: " + evaluation.reason());
        }
        List<ScheduledJob> placements = new ArrayList<>(evaluation.startTimes().size());
        for (Map.Entry<String, Long> e : evaluation.startTimes().entrySet()) {
            Job job = problem.job(e.getKey());
            long start = e.getValue();
            placements.add(new ScheduledJob(job.id(), start, start + job.processingTime(), job.requiredMachines()));
        }
        return new Schedule(placements);
    }

    public PrecedenceRule rule() {
        return rule;
    }

    private void requirePermutation(List<String> order) {
        Objects.requireNonNull(order, "order must not be null");
        if (order.size() != problem.jobCount()) {
            throw new IllegalArgumentException(
                    "order must contain every job exactly once: size=" + order.size() + ", jobs=" + problem.jobCount());
        }
        Set<String> seen = new HashSet<>();
        for (String id : order) {
            if (!problem.containsJob(id)) {
                throw new IllegalArgumentException("order contains unknown job: " + id);
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("order contains job twice: " + id);
            }
        }
    }
}
