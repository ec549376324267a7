package io.jobplan4j.core;

/**
 * How the evaluator-based solvers (list, genetic) interpret a dependency.
 *
 * <p>Both rules require the predecessor to appear earlier in the evaluated order.
 * The backtracking solver always uses completion semantics.
 */
public enum PrecedenceRule {
    /**
     * Predecessor only has to be placed earlier in the same pass; the successor may start
     * as soon as its machines are free.
     */
    PLACEMENT {
        @Override
        public boolean waitsForCompletion() {
            return false;
        }
    },
    /**
     * Successor starts no earlier than the end of its latest predecessor.
     */
    COMPLETION {
        @Override
        public boolean waitsForCompletion() {
            return true;
        }
    };

    public abstract boolean waitsForCompletion();
}
