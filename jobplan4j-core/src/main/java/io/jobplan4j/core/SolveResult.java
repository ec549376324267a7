package io.jobplan4j.core;

import java.util.Objects;

/**
 * Result of a solver run.
 *
 * status   : outcome
 * schedule : computed schedule, non-null only when status is SOLVED
 * message  : human-readable detail for failures, null on success
 */
public record SolveResult(
        SolveStatus status,
        Schedule schedule,
        String message
) {
    public SolveResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == SolveStatus.SOLVED && schedule == null) {
            throw new IllegalArgumentException("SOLVED result requires a schedule");
        }
        if (status != SolveStatus.SOLVED && schedule != null) {
            throw new IllegalArgumentException(status + " result must not carry a schedule");
        }
    }

    public static SolveResult solved(Schedule schedule) {
        return new SolveResult(SolveStatus.SOLVED, Objects.requireNonNull(schedule, "schedule must not be null"), null);
    }

    public static SolveResult noValidOrder(String message) {
        return new SolveResult(SolveStatus.NO_VALID_ORDER, null, message);
    }

    public static SolveResult cycleDetected(String message) {
        return new SolveResult(SolveStatus.CYCLE_DETECTED, null, message);
    }

    public static SolveResult infeasible(String message) {
        return new SolveResult(SolveStatus.INFEASIBLE, null, message);
    }

    public static SolveResult allCandidatesInfeasible(String message) {
        return new SolveResult(SolveStatus.ALL_CANDIDATES_INFEASIBLE, null, message);
    }

    public static SolveResult timeout(String message) {
        return new SolveResult(SolveStatus.TIMEOUT, null, message);
    }

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }

    public long makespan() {
        if (schedule == null) {
            throw new IllegalStateException("No schedule for status " + status);
        }
        return schedule.makespan();
    }
}
