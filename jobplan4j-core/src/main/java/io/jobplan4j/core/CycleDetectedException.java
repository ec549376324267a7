package io.jobplan4j.core;

/**
 * The dependency graph contains a cycle, so no topological order exists.
 */
public class CycleDetectedException extends Exception {

    private final int sortedCount;
    private final int jobCount;

    public CycleDetectedException(int sortedCount, int jobCount) {
        super("Circular dependency detected: sorted=" + sortedCount + ", jobs=" + jobCount);
        this.sortedCount = sortedCount;
        this.jobCount = jobCount;
    }

    public int sortedCount() {
        return sortedCount;
    }

    public int jobCount() {
        return jobCount;
    }
}
