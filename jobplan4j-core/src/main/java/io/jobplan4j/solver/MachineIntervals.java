package io.jobplan4j.solver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Booked {@code [start, end)} intervals per machine, used by the backtracking search.
 *
 * <p>Unlike a single "next free" time, this supports placing jobs out of time order and
 * testing arbitrary gaps. {@link #commit} and {@link #rollback} are exact inverses;
 * a rollback must match the most recent commit of the same job.
 */
final class MachineIntervals {

    record Interval(String jobId, long start, long end) {
        boolean overlaps(long otherStart, long otherEnd) {
            return !(otherEnd <= start || otherStart >= end);
        }
    }

    private final Map<String, List<Interval>> booked = new HashMap<>();

    MachineIntervals(List<String> machineIds) {
        for (String id : machineIds) {
            booked.put(id, new ArrayList<>());
        }
    }

    /**
     * True if {@code [start, end)} is free on every given machine.
     */
    boolean isSafe(List<String> machines, long start, long end) {
        for (String m : machines) {
            for (Interval existing : lane(m)) {
                if (existing.overlaps(start, end)) {
                    return false;
                }
            }
        }
        return true;
    }

    void commit(String jobId, List<String> machines, long start, long end) {
        Interval interval = new Interval(jobId, start, end);
        for (String m : machines) {
            lane(m).add(interval);
        }
    }

    void rollback(String jobId, List<String> machines) {
        for (String m : machines) {
            List<Interval> lane = lane(m);
            Interval last = lane.remove(lane.size() - 1);
            if (!last.jobId().equals(jobId)) {
                throw new IllegalStateException("Rollback out of order on machine " + m
                        + ": expected job " + jobId + " but found " + last.jobId());
            }
        }
    }

    int bookedCount(String machineId) {
        return lane(machineId).size();
    }

    private List<Interval> lane(String machineId) {
        return Objects.requireNonNull(booked.get(machineId), () -> "unknown machine: " + machineId);
    }
}
