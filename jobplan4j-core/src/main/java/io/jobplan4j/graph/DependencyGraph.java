package io.jobplan4j.graph;

import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.Dependency;
import io.jobplan4j.core.Job;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.UnknownReferenceException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Precedence graph derived from jobs and dependencies.
 *
 * <p>Adjacency maps each job to its successors; in-degree counts distinct predecessors.
 * Both keep job insertion order so that {@link #topologicalOrder()} is deterministic.
 * The graph is immutable; every topological sort works on a copy of the in-degree table.
 */
public final class DependencyGraph {

    private final List<String> jobIds;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    private DependencyGraph(List<String> jobIds,
                            Map<String, Set<String>> successors,
                            Map<String, Set<String>> predecessors) {
        this.jobIds = jobIds;
        this.successors = successors;
        this.predecessors = predecessors;
    }

    public static DependencyGraph build(Problem problem) {
        Objects.requireNonNull(problem, "problem must not be null");
        return build(problem.jobs(), problem.dependencies());
    }

    /**
     * Build the graph.
     *
     * @throws UnknownReferenceException if a dependency names a job that is not in {@code jobs}
     */
    public static DependencyGraph build(List<Job> jobs, List<Dependency> dependencies) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");

        Map<String, Set<String>> succ = new LinkedHashMap<>();
        Map<String, Set<String>> pred = new LinkedHashMap<>();
        for (Job job : jobs) {
            if (succ.putIfAbsent(job.id(), new LinkedHashSet<>()) != null) {
                throw new IllegalArgumentException("Duplicate job id: " + job.id());
            }
            pred.put(job.id(), new LinkedHashSet<>());
        }

        for (Dependency d : dependencies) {
            Set<String> out = succ.get(d.predecessorId());
            if (out == null) {
                throw new UnknownReferenceException(
                        "Dependency references unknown job: " + d.predecessorId(), d.predecessorId());
            }
            Set<String> in = pred.get(d.successorId());
            if (in == null) {
                throw new UnknownReferenceException(
                        "Dependency references unknown job: " + d.successorId(), d.successorId());
            }
            out.add(d.successorId());
            in.add(d.predecessorId());
        }

        return new DependencyGraph(
                List.copyOf(succ.keySet()),
                freeze(succ),
                freeze(pred)
        );
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> map) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : map.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Kahn's algorithm.
     *
     * <p>The worklist is FIFO, seeded with zero in-degree jobs in insertion order; successors
     * that reach zero are appended in edge insertion order.
     *
     * @return every job id, each after all of its predecessors
     * @throws CycleDetectedException if fewer than all jobs could be sorted
     */
    public List<String> topologicalOrder() throws CycleDetectedException {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : jobIds) {
            inDegree.put(id, predecessors.get(id).size());
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                queue.offer(e.getKey());
            }
        }

        List<String> order = new ArrayList<>(jobIds.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String next : successors.get(current)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(next);
                }
            }
        }

        if (order.size() < jobIds.size()) {
            throw new CycleDetectedException(order.size(), jobIds.size());
        }
        return order;
    }

    public boolean isAcyclic() {
        try {
            topologicalOrder();
            return true;
        } catch (CycleDetectedException e) {
            return false;
        }
    }

    /**
     * Direct predecessors of a job.
     */
    public Set<String> predecessors(String jobId) {
        return lookup(predecessors, jobId);
    }

    /**
     * Direct successors of a job.
     */
    public Set<String> successors(String jobId) {
        return lookup(successors, jobId);
    }

    public List<String> jobIds() {
        return jobIds;
    }

    public int jobCount() {
        return jobIds.size();
    }

    public int inDegree(String jobId) {
        return predecessors(jobId).size();
    }

    private static Set<String> lookup(Map<String, Set<String>> map, String jobId) {
        Set<String> set = map.get(jobId);
        if (set == null) {
            throw new UnknownReferenceException("Unknown job: " + jobId, jobId);
        }
        return set;
    }
}
