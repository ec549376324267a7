package io.jobplan4j.solver;

import io.jobplan4j.ProblemBuilder;
import io.jobplan4j.TestProblems;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.Schedule;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.core.SolveStatus;
import io.jobplan4j.graph.DependencyGraph;
import io.jobplan4j.utils.ScheduleVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BacktrackingSolverTest {

    private final Problem workshop = TestProblems.workshop();
    private final DependencyGraph graph = DependencyGraph.build(workshop);

    @Test
    void workshopShouldFitInHorizonTwenty() {
        SolveResult result = new BacktrackingSolver(20)
                .solve(workshop, graph, List.of("1", "2", "3", "4", "5"));

        assertEquals(SolveStatus.SOLVED, result.status());
        Schedule schedule = result.schedule();
        assertTrue(schedule.makespan() <= 20);
        assertEquals(8, schedule.startTime("4"));
        assertEquals(14, schedule.startTime("5"));
        assertEquals(List.of(), ScheduleVerifier.violations(workshop, schedule, PrecedenceRule.COMPLETION));
    }

    @Test
    void workshopShouldBeInfeasibleInHorizonFive() {
        SolveResult result = new BacktrackingSolver(5)
                .solve(workshop, graph, List.of("1", "2", "3", "4", "5"));

        assertEquals(SolveStatus.INFEASIBLE, result.status());
        assertTrue(result.status().retryMayHelp());
    }

    @Test
    void horizonBelowMachineLoadShouldBeInfeasible() {
        // machine B needs 8 + 6 + 4 = 18
        SolveResult result = new BacktrackingSolver(17).solve(workshop);

        assertEquals(SolveStatus.INFEASIBLE, result.status());
    }

    @Test
    void earlierJobShouldMoveWhenLaterJobCannotFit() {
        // z holds B over [1, 3) because it waits for p; y needs A and B together.
        // x at 0 leaves y no slot before 3, so x has to move to 1 and y takes 0.
        Problem problem = Problem.builder()
                .machine("A", 1).machine("B", 1).machine("C", 1)
                .job("p", 1, "C")
                .job("z", 2, "B")
                .job("x", 1, "A")
                .job("y", 1, "A", "B")
                .dependency("p", "z")
                .build();

        SolveResult result = new BacktrackingSolver(3)
                .solve(problem, DependencyGraph.build(problem), List.of("p", "z", "x", "y"));

        assertEquals(SolveStatus.SOLVED, result.status());
        assertEquals(1, result.schedule().startTime("z"));
        assertEquals(1, result.schedule().startTime("x"));
        assertEquals(0, result.schedule().startTime("y"));
        assertEquals(3, result.makespan());
    }

    @Test
    void successorShouldStartAfterPredecessorEnds() {
        Problem problem = Problem.builder()
                .machine("A", 1).machine("B", 1)
                .job("p", 4, "A")
                .job("s", 2, "B")
                .dependency("p", "s")
                .build();

        SolveResult result = new BacktrackingSolver(10).solve(problem);

        assertEquals(4, result.schedule().startTime("s"));
    }

    @Test
    void cycleShouldBeReported() {
        assertEquals(SolveStatus.CYCLE_DETECTED, new BacktrackingSolver(10).solve(TestProblems.twoJobCycle()).status());
    }

    @Test
    void totalProcessingTimeShouldAlwaysBeEnough() {
        Problem chain = TestProblems.chain(6);

        SolveResult result = new BacktrackingSolver(chain.totalProcessingTime()).solve(chain);

        assertEquals(6, result.makespan());
    }

    @Test
    void invalidArgumentsShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> new BacktrackingSolver(0));
        assertThrows(IllegalArgumentException.class,
                () -> new BacktrackingSolver(10).solve(workshop, graph, List.of("1", "2")));
    }

    @Test
    void interruptedSearchShouldUnwindWithTimeout() {
        Problem crowded = crowdedMachine(14);
        Thread.currentThread().interrupt();
        try {
            SolveResult result = new BacktrackingSolver(13).solve(crowded);

            assertEquals(SolveStatus.TIMEOUT, result.status());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    private static Problem crowdedMachine(int jobs) {
        ProblemBuilder b = Problem.builder().machine("A", 1);
        for (int i = 1; i <= jobs; i++) {
            b.job("j" + i, 1, "A");
        }
        return b.build();
    }
}
