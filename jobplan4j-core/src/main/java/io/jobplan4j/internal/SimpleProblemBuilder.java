package io.jobplan4j.internal;

import io.jobplan4j.ProblemBuilder;
import io.jobplan4j.core.Dependency;
import io.jobplan4j.core.Job;
import io.jobplan4j.core.Machine;
import io.jobplan4j.core.Problem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link ProblemBuilder} implementation.
 */
public class SimpleProblemBuilder implements ProblemBuilder {

    private final List<Job> jobs = new ArrayList<>();
    private final List<Dependency> dependencies = new ArrayList<>();
    private final List<Machine> machines = new ArrayList<>();

    @Override
    public ProblemBuilder machine(String id, int capacity) {
        return machine(new Machine(id, capacity));
    }

    @Override
    public ProblemBuilder machine(Machine machine) {
        Objects.requireNonNull(machine, "machine must not be null");
        machines.add(machine);
        return this;
    }

    @Override
    public ProblemBuilder job(String id, long processingTime, String... requiredMachines) {
        Objects.requireNonNull(requiredMachines, "requiredMachines must not be null");
        return job(new Job(id, processingTime, List.of(requiredMachines)));
    }

    @Override
    public ProblemBuilder job(String id, long processingTime, List<String> requiredMachines) {
        return job(new Job(id, processingTime, requiredMachines));
    }

    @Override
    public ProblemBuilder job(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        jobs.add(job);
        return this;
    }

    @Override
    public ProblemBuilder dependency(String predecessorId, String successorId) {
        return dependency(new Dependency(predecessorId, successorId));
    }

    @Override
    public ProblemBuilder dependency(Dependency dependency) {
        Objects.requireNonNull(dependency, "dependency must not be null");
        dependencies.add(dependency);
        return this;
    }

    @Override
    public ProblemBuilder dependsOn(String jobId, String... predecessorIds) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(predecessorIds, "predecessorIds must not be null");
        for (String p : predecessorIds) {
            dependency(p, jobId);
        }
        return this;
    }

    @Override
    public Problem build() {
        return Problem.of(jobs, dependencies, machines);
    }
}
