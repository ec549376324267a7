package io.jobplan4j.core;

import java.util.Objects;

/**
 * A machine that runs at most one job interval at a time.
 *
 * <p>{@code capacity} is validated but not enforced by any solver; occupancy is binary.
 */
public record Machine(
        String id,
        int capacity
) {
    public Machine {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: machine=" + id);
        }
    }
}
