package io.jobplan4j.core;

/**
 * Outcome of a solver run.
 */
public enum SolveStatus {
    SOLVED {
        @Override
        public boolean retryMayHelp() {
            return false;
        }
    },
    /**
     * The list scheduler found no topological order.
     */
    NO_VALID_ORDER {
        @Override
        public boolean retryMayHelp() {
            return false;
        }
    },
    /**
     * The dependency graph is not a DAG; no solver was run.
     */
    CYCLE_DETECTED {
        @Override
        public boolean retryMayHelp() {
            return false;
        }
    },
    /**
     * Backtracking exhausted the time horizon. A larger horizon may succeed.
     */
    INFEASIBLE {
        @Override
        public boolean retryMayHelp() {
            return true;
        }
    },
    /**
     * Every individual of the final genetic population violated precedence.
     */
    ALL_CANDIDATES_INFEASIBLE {
        @Override
        public boolean retryMayHelp() {
            return true;
        }
    },
    /**
     * The wall-clock budget of the calling service ran out.
     */
    TIMEOUT {
        @Override
        public boolean retryMayHelp() {
            return true;
        }
    };

    public abstract boolean retryMayHelp();
}
