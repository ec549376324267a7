package io.jobplan4j.core;

import java.util.List;
import java.util.Objects;

/**
 * One placed job: it holds all of {@code machines} over {@code [start, end)}.
 */
public record ScheduledJob(
        String jobId,
        long start,
        long end,
        List<String> machines
) {
    public ScheduledJob {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative: job=" + jobId);
        }
        if (end <= start) {
            throw new IllegalArgumentException("end must be after start: job=" + jobId);
        }
        machines = List.copyOf(machines);
    }

    public long duration() {
        return end - start;
    }

    public boolean overlaps(ScheduledJob other) {
        return !(end <= other.start || start >= other.end);
    }
}
