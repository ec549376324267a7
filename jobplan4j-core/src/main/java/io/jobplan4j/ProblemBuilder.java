package io.jobplan4j;

import io.jobplan4j.core.Dependency;
import io.jobplan4j.core.Job;
import io.jobplan4j.core.Machine;
import io.jobplan4j.core.Problem;

import java.util.List;

/**
 * Fluent builder for a scheduling {@link Problem}.
 *
 * <p>Note:
 * <ul>
 *   <li>entries may be added in any order; references are resolved in build()</li>
 *   <li>build(): validates ids and references and returns an immutable problem</li>
 * </ul>
 */
public interface ProblemBuilder {

    /**
     * Add a machine. Capacity is kept but not used by any solver.
     */
    ProblemBuilder machine(String id, int capacity);

    ProblemBuilder machine(Machine machine);

    /**
     * Add a job occupying all given machines for {@code processingTime}.
     */
    ProblemBuilder job(String id, long processingTime, String... requiredMachines);

    ProblemBuilder job(String id, long processingTime, List<String> requiredMachines);

    ProblemBuilder job(Job job);

    /**
     * {@code successorId} may not start before {@code predecessorId}.
     */
    ProblemBuilder dependency(String predecessorId, String successorId);

    ProblemBuilder dependency(Dependency dependency);

    /**
     * Add one dependency per predecessor, all pointing at {@code jobId}.
     */
    ProblemBuilder dependsOn(String jobId, String... predecessorIds);

    /**
     * Build an immutable problem.
     *
     * @throws io.jobplan4j.core.UnknownReferenceException if a dependency or job names a missing id
     */
    Problem build();
}
