package io.jobplan4j.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable job definition.
 *
 * <p>A job occupies every machine in {@code requiredMachines} simultaneously for its whole
 * {@code processingTime}. A single-machine job is just a list of length one.
 */
public record Job(
        String id,
        long processingTime,
        List<String> requiredMachines
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (processingTime <= 0) {
            throw new IllegalArgumentException("processingTime must be positive: job=" + id);
        }
        Objects.requireNonNull(requiredMachines, "requiredMachines must not be null");
        if (requiredMachines.isEmpty()) {
            throw new IllegalArgumentException("requiredMachines must not be empty: job=" + id);
        }

        Set<String> seen = new LinkedHashSet<>();
        for (String m : requiredMachines) {
            if (m == null || m.isBlank()) {
                throw new IllegalArgumentException("requiredMachines contains blank machine id: job=" + id);
            }
            if (!seen.add(m)) {
                throw new IllegalArgumentException("Duplicate required machine " + m + " on job " + id);
            }
        }
        requiredMachines = List.copyOf(seen);
    }

    public static Job of(String id, long processingTime, String... requiredMachines) {
        return new Job(id, processingTime, List.of(requiredMachines));
    }
}
