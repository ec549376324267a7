package io.jobplan4j.internal;

import io.jobplan4j.Planner;
import io.jobplan4j.TestProblems;
import io.jobplan4j.core.CycleDetectedException;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.core.SolveStatus;
import io.jobplan4j.solver.genetic.GeneticOptions;
import io.jobplan4j.utils.ScheduleVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultPlannerTest {

    private final Planner planner = new DefaultPlanner(TestProblems.workshop());

    @Test
    void everySolverShouldScheduleWorkshop() {
        SolveResult list = planner.runListSchedule();
        SolveResult genetic = planner.runGenetic(50, 100, 0.1, 42L);
        SolveResult exact = planner.runBacktracking(20);

        for (SolveResult result : List.of(list, genetic, exact)) {
            assertEquals(SolveStatus.SOLVED, result.status());
            assertEquals(18, result.makespan());
            assertEquals(List.of(), ScheduleVerifier.violations(
                    planner.problem(), result.schedule(), PrecedenceRule.COMPLETION));
        }
    }

    @Test
    void cycleShouldStopEverySolver() {
        Planner cyclic = new DefaultPlanner(TestProblems.twoJobCycle());

        assertEquals(SolveStatus.CYCLE_DETECTED, cyclic.runListSchedule().status());
        assertEquals(SolveStatus.CYCLE_DETECTED, cyclic.runGenetic(GeneticOptions.defaults()).status());
        assertEquals(SolveStatus.CYCLE_DETECTED, cyclic.runBacktracking(100).status());
        assertNull(cyclic.runListSchedule().schedule());
        assertThrows(CycleDetectedException.class, () -> cyclic.optimize(GeneticOptions.defaults()));
    }

    @Test
    void smallHorizonShouldBeInfeasible() {
        SolveResult result = planner.runBacktracking(5);

        assertEquals(SolveStatus.INFEASIBLE, result.status());
    }

    @Test
    void infeasibleFinalPopulationShouldBeReportedDistinctly() {
        Planner chain = new DefaultPlanner(TestProblems.chain(8));

        SolveResult result = chain.runGenetic(4, 0, 0.0, 2L);

        assertEquals(SolveStatus.ALL_CANDIDATES_INFEASIBLE, result.status());
    }

    @Test
    void optimizeShouldExposeOrderAndHistory() throws Exception {
        var result = planner.optimize(new GeneticOptions(20, 10, 0.2, 8L));

        assertEquals(5, result.bestOrder().size());
        assertEquals(11, result.bestSeenHistory().size());
        assertTrue(result.bestMakespan() >= 18);
    }

    @Test
    void interruptedSolversShouldReportTimeout() {
        Thread.currentThread().interrupt();
        try {
            assertEquals(SolveStatus.TIMEOUT, planner.runGenetic(GeneticOptions.defaults()).status());
            assertEquals(SolveStatus.TIMEOUT, planner.runBacktracking(20).status());
        } finally {
            Thread.interrupted();
        }
        assertEquals(SolveStatus.SOLVED, planner.runBacktracking(20).status());
    }
}
