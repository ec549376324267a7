package io.jobplan4j.utils;

import io.jobplan4j.core.Dependency;
import io.jobplan4j.core.Job;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.Schedule;
import io.jobplan4j.core.ScheduledJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks a schedule against its problem.
 * <p>
 * Reported violations:
 * <ul>
 *   <li>a job is missing, or placed with the wrong duration or machines</li>
 *   <li>two jobs overlap on a machine</li>
 *   <li>a successor starts before its predecessor ends, under {@link PrecedenceRule#COMPLETION}</li>
 * </ul>
 */
public final class ScheduleVerifier {
    private ScheduleVerifier() {
    }

    /**
     * @return human-readable violations; empty when the schedule is valid
     */
    public static List<String> violations(Problem problem, Schedule schedule, PrecedenceRule rule) {
        Objects.requireNonNull(problem, "problem must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(rule, "rule must not be null");

        List<String> violations = new ArrayList<>();

        for (Job job : problem.jobs()) {
            if (!schedule.contains(job.id())) {
                violations.add("job " + job.id() + " is not scheduled");
                continue;
            }
            ScheduledJob sj = schedule.get(job.id());
            if (sj.duration() != job.processingTime()) {
                violations.add("job " + job.id() + " runs " + sj.duration() + " instead of " + job.processingTime());
            }
            if (!sj.machines().equals(job.requiredMachines())) {
                violations.add("job " + job.id() + " holds " + sj.machines() + " instead of " + job.requiredMachines());
            }
        }

        for (String machineId : schedule.machineIds()) {
            List<ScheduledJob> lane = schedule.machineTimeline(machineId);
            // Lane is sorted by start; a long placement can overlap several later ones.
            for (int i = 1; i < lane.size(); i++) {
                ScheduledJob curr = lane.get(i);
                for (int j = 0; j < i; j++) {
                    ScheduledJob prev = lane.get(j);
                    if (prev.overlaps(curr)) {
                        violations.add("jobs " + prev.jobId() + " and " + curr.jobId() + " overlap on machine " + machineId);
                    }
                }
            }
        }

        // Under PLACEMENT precedence only constrains the evaluated order, not start times.
        if (!rule.waitsForCompletion()) {
            return violations;
        }
        for (Dependency d : problem.dependencies()) {
            if (!schedule.contains(d.predecessorId()) || !schedule.contains(d.successorId())) {
                continue;
            }
            ScheduledJob pred = schedule.get(d.predecessorId());
            ScheduledJob succ = schedule.get(d.successorId());
            if (succ.start() < pred.end()) {
                violations.add("job " + succ.jobId() + " starts at " + succ.start()
                        + " before predecessor " + pred.jobId() + " ends at " + pred.end());
            }
        }
        return violations;
    }

    public static boolean isValid(Problem problem, Schedule schedule, PrecedenceRule rule) {
        return violations(problem, schedule, rule).isEmpty();
    }
}
