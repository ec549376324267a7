package io.jobplan4j.core;

import java.util.Objects;

/**
 * Ordered pair: {@code successorId} may not start before {@code predecessorId}
 * (see {@link PrecedenceRule} for what "before" means to each solver).
 */
public record Dependency(
        String predecessorId,
        String successorId
) {
    public Dependency {
        Objects.requireNonNull(predecessorId, "predecessorId must not be null");
        Objects.requireNonNull(successorId, "successorId must not be null");
    }
}
