package io.jobplan4j.solver;

import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.Job;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.Schedule;
import io.jobplan4j.core.ScheduledJob;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.graph.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Exact chronological backtracking over per-job start times.
 *
 * <p>Jobs are taken in a fixed order. For each job, start times are tried in increasing
 * order from its release time (the latest end of its predecessors placed earlier in the order)
 * while the job still ends within {@code timeHorizon}. A start is taken only if the interval is
 * free on every required machine; it is committed on all of them at once and rolled back when
 * the rest of the order cannot be placed.
 *
 * <p>The search is exhaustive: it reports infeasibility only after every alternative of every
 * job has been tried. Worst case is exponential in the number of jobs; there is no pruning
 * beyond the interval check and no memoization. Predecessors that come later in the order are
 * not checked, so callers must pass a precedence-respecting order.
 *
 * <p>Recursion depth equals the job count. The search checks the thread's interrupt flag once per
 * candidate start and unwinds with a {@link io.jobplan4j.core.SolveStatus#TIMEOUT} result when it
 * is set.
 */
public class BacktrackingSolver {
    private static final Logger log = LoggerFactory.getLogger(BacktrackingSolver.class);

    private final long timeHorizon;

    public BacktrackingSolver(long timeHorizon) {
        if (timeHorizon <= 0) {
            throw new IllegalArgumentException("timeHorizon must be positive");
        }
        this.timeHorizon = timeHorizon;
    }

    /**
     * Solve using the topological order of the problem's dependency graph.
     */
    public SolveResult solve(Problem problem) {
        Objects.requireNonNull(problem, "problem must not be null");
        DependencyGraph graph = DependencyGraph.build(problem);
        try {
            return solve(problem, graph, graph.topologicalOrder());
        } catch (CycleDetectedException e) {
            return SolveResult.cycleDetected(e.getMessage());
        }
    }

    public SolveResult solve(Problem problem, DependencyGraph graph, List<String> order) {
        Objects.requireNonNull(problem, "problem must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(order, "order must not be null");
        requirePermutation(problem, order);

        Search search = new Search(problem, graph, order);
        boolean found = search.place(0);

        if (search.interrupted) {
            log.warn("Backtracking interrupted horizon={} jobs={} nodes={}", timeHorizon, order.size(), search.nodes);
            return SolveResult.timeout("Backtracking interrupted after " + search.nodes + " candidate starts");
        }
        if (!found) {
            log.warn("Backtracking exhausted horizon={} jobs={} nodes={}", timeHorizon, order.size(), search.nodes);
            return SolveResult.infeasible("No placement of " + order.size()
                    + " jobs fits within time horizon " + timeHorizon);
        }

        List<ScheduledJob> placements = new ArrayList<>(order.size());
        for (String jobId : order) {
            Job job = problem.job(jobId);
            long start = search.starts.get(jobId);
            placements.add(new ScheduledJob(jobId, start, start + job.processingTime(), job.requiredMachines()));
        }
        Schedule schedule = new Schedule(placements);
        log.debug("Backtracking solved horizon={} makespan={} nodes={}", timeHorizon, schedule.makespan(), search.nodes);
        return SolveResult.solved(schedule);
    }

    public long timeHorizon() {
        return timeHorizon;
    }

    private static void requirePermutation(Problem problem, List<String> order) {
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

    /**
     * State of one solve call.
     */
    private final class Search {
        private final Problem problem;
        private final DependencyGraph graph;
        private final List<String> order;
        private final MachineIntervals intervals;
        private final Map<String, Long> starts = new HashMap<>();
        private long nodes;
        private boolean interrupted;

        private Search(Problem problem, DependencyGraph graph, List<String> order) {
            this.problem = problem;
            this.graph = graph;
            this.order = order;
            this.intervals = new MachineIntervals(problem.machineIds());
        }

        private boolean place(int index) {
            if (index == order.size()) {
                return true;
            }

            Job job = problem.job(order.get(index));
            List<String> machines = job.requiredMachines();
            long duration = job.processingTime();

            for (long start = releaseTime(job); start + duration <= timeHorizon; start++) {
                if (Thread.currentThread().isInterrupted()) {
                    interrupted = true;
                    return false;
                }
                long end = start + duration;
                nodes++;
                if (!intervals.isSafe(machines, start, end)) {
                    continue;
                }

                intervals.commit(job.id(), machines, start, end);
                starts.put(job.id(), start);

                if (place(index + 1)) {
                    return true;
                }

                starts.remove(job.id());
                intervals.rollback(job.id(), machines);
            }
            return false;
        }

        private long releaseTime(Job job) {
            long release = 0;
            for (String p : graph.predecessors(job.id())) {
                Long predStart = starts.get(p);
                if (predStart != null) {
                    release = Math.max(release, predStart + problem.job(p).processingTime());
                }
            }
            return release;
        }
    }
}
