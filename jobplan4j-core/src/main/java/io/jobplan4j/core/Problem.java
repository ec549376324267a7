package io.jobplan4j.core;

import io.jobplan4j.ProblemBuilder;
import io.jobplan4j.internal.SimpleProblemBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated scheduling request: jobs, dependencies and machines.
 *
 * <p>Ids are unique per kind and every reference resolves. Insertion order of jobs is kept,
 * since it drives the topological tie-break and therefore list scheduler output.
 */
public final class Problem {

    private final Map<String, Job> jobsById;
    private final List<Dependency> dependencies;
    private final Map<String, Machine> machinesById;

    private Problem(List<Job> jobs, List<Dependency> dependencies, List<Machine> machines) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        Objects.requireNonNull(machines, "machines must not be null");

        Map<String, Machine> machineMap = new LinkedHashMap<>();
        for (Machine m : machines) {
            Objects.requireNonNull(m, "machines must not contain null");
            if (machineMap.putIfAbsent(m.id(), m) != null) {
                throw new IllegalArgumentException("Duplicate machine id: " + m.id());
            }
        }

        Map<String, Job> jobMap = new LinkedHashMap<>();
        for (Job j : jobs) {
            Objects.requireNonNull(j, "jobs must not contain null");
            if (jobMap.putIfAbsent(j.id(), j) != null) {
                throw new IllegalArgumentException("Duplicate job id: " + j.id());
            }
            for (String machineId : j.requiredMachines()) {
                if (!machineMap.containsKey(machineId)) {
                    throw new UnknownReferenceException(
                            "Job " + j.id() + " requires unknown machine: " + machineId, machineId);
                }
            }
        }

        for (Dependency d : dependencies) {
            Objects.requireNonNull(d, "dependencies must not contain null");
            requireJob(jobMap, d.predecessorId());
            requireJob(jobMap, d.successorId());
        }

        this.jobsById = Collections.unmodifiableMap(jobMap);
        this.dependencies = List.copyOf(dependencies);
        this.machinesById = Collections.unmodifiableMap(machineMap);
    }

    public static Problem of(List<Job> jobs, List<Dependency> dependencies, List<Machine> machines) {
        return new Problem(jobs, dependencies, machines);
    }

    public static ProblemBuilder builder() {
        return new SimpleProblemBuilder();
    }

    private static void requireJob(Map<String, Job> jobMap, String jobId) {
        if (!jobMap.containsKey(jobId)) {
            throw new UnknownReferenceException("Dependency references unknown job: " + jobId, jobId);
        }
    }

    public List<Job> jobs() {
        return List.copyOf(jobsById.values());
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public List<Machine> machines() {
        return List.copyOf(machinesById.values());
    }

    public Job job(String id) {
        Job job = jobsById.get(id);
        if (job == null) {
            throw new UnknownReferenceException("Unknown job: " + id, id);
        }
        return job;
    }

    public boolean containsJob(String id) {
        return jobsById.containsKey(id);
    }

    public int jobCount() {
        return jobsById.size();
    }

    public List<String> jobIds() {
        return List.copyOf(jobsById.keySet());
    }

    public List<String> machineIds() {
        return List.copyOf(machinesById.keySet());
    }

    /**
     * Sum of all processing times. A backtracking horizon of at least this size always admits
     * the serial schedule of a precedence-respecting order.
     */
    public long totalProcessingTime() {
        long total = 0;
        for (Job j : jobsById.values()) {
            total += j.processingTime();
        }
        return total;
    }

    @Override
    public String toString() {
        return "Problem{jobs=" + jobsById.size()
                + ", dependencies=" + dependencies.size()
                + ", machines=" + machinesById.size() + "}";
    }
}
