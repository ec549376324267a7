package io.jobplan4j.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of replaying one job order against machine availability.
 *
 * feasible   : false when a job came before one of its predecessors
 * order      : the evaluated order
 * startTimes : job id to start time, in placement order (empty when infeasible)
 * makespan   : latest machine free time, or {@link Long#MAX_VALUE} when infeasible
 * reason     : why the order was rejected, null when feasible
 */
public record Evaluation(
        boolean feasible,
        List<String> order,
        Map<String, Long> startTimes,
        long makespan,
        String reason
) {
    public static final long INFEASIBLE_FITNESS = Long.MAX_VALUE;

    public Evaluation {
        order = List.copyOf(order);
        startTimes = Collections.unmodifiableMap(new LinkedHashMap<>(startTimes));
    }

    public static Evaluation feasible(List<String> order, Map<String, Long> startTimes, long makespan) {
        return new Evaluation(true, order, startTimes, makespan, null);
    }

    public static Evaluation infeasible(List<String> order, String reason) {
        return new Evaluation(false, order, Map.of(), INFEASIBLE_FITNESS, reason);
    }

    /**
     * Lower is better; infeasible orders score worst.
     */
    public long fitness() {
        return feasible ? makespan : INFEASIBLE_FITNESS;
    }
}
