package io.jobplan4j.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computed schedule: job id to placement, plus the makespan.
 *
 * <p>Iteration order is the order in which the solver placed the jobs.
 */
public final class Schedule {

    private final Map<String, ScheduledJob> entries;
    private final long makespan;

    public Schedule(Collection<ScheduledJob> placements) {
        Objects.requireNonNull(placements, "placements must not be null");
        Map<String, ScheduledJob> map = new LinkedHashMap<>();
        long max = 0;
        for (ScheduledJob sj : placements) {
            if (map.putIfAbsent(sj.jobId(), sj) != null) {
                throw new IllegalArgumentException("Job placed twice: " + sj.jobId());
            }
            max = Math.max(max, sj.end());
        }
        this.entries = Collections.unmodifiableMap(map);
        this.makespan = max;
    }

    public ScheduledJob get(String jobId) {
        ScheduledJob sj = entries.get(jobId);
        if (sj == null) {
            throw new IllegalArgumentException("Job not in schedule: " + jobId);
        }
        return sj;
    }

    public long startTime(String jobId) {
        return get(jobId).start();
    }

    public boolean contains(String jobId) {
        return entries.containsKey(jobId);
    }

    public List<ScheduledJob> jobs() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Time at which the last machine finishes its last job.
     */
    public long makespan() {
        return makespan;
    }

    /**
     * Machines used by at least one job, in first-use order.
     */
    public List<String> machineIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ScheduledJob sj : entries.values()) {
            ids.addAll(sj.machines());
        }
        return List.copyOf(ids);
    }

    /**
     * Placements on one machine sorted by start time, i.e. one lane of a Gantt chart.
     */
    public List<ScheduledJob> machineTimeline(String machineId) {
        List<ScheduledJob> lane = new ArrayList<>();
        for (ScheduledJob sj : entries.values()) {
            if (sj.machines().contains(machineId)) {
                lane.add(sj);
            }
        }
        lane.sort(Comparator.comparingLong(ScheduledJob::start).thenComparing(ScheduledJob::jobId));
        return lane;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schedule other)) return false;
        return makespan == other.makespan && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, makespan);
    }

    @Override
    public String toString() {
        return "Schedule{makespan=" + makespan + ", jobs=" + entries.values() + "}";
    }
}
