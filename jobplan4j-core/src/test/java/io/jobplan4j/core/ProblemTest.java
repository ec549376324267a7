package io.jobplan4j.core;

import io.jobplan4j.TestProblems;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProblemTest {

    @Test
    void builderShouldKeepInsertionOrder() {
        Problem problem = TestProblems.workshop();

        assertEquals(List.of("1", "2", "3", "4", "5"), problem.jobIds());
        assertEquals(List.of("A", "B", "C"), problem.machineIds());
        assertEquals(3, problem.dependencies().size());
        assertEquals(List.of("A", "B"), problem.job("4").requiredMachines());
        assertEquals(26, problem.totalProcessingTime());
    }

    @Test
    void dependencyOnUnknownJobShouldFail() {
        UnknownReferenceException ex = assertThrows(UnknownReferenceException.class, () -> Problem.builder()
                .machine("A", 1)
                .job("1", 1, "A")
                .dependency("1", "9")
                .build());

        assertEquals("9", ex.reference());
    }

    @Test
    void jobOnUnknownMachineShouldFail() {
        UnknownReferenceException ex = assertThrows(UnknownReferenceException.class, () -> Problem.builder()
                .machine("A", 1)
                .job("1", 1, "A", "Z")
                .build());

        assertEquals("Z", ex.reference());
    }

    @Test
    void duplicateIdsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Problem.builder()
                .machine("A", 1)
                .machine("A", 2)
                .build());

        assertThrows(IllegalArgumentException.class, () -> Problem.builder()
                .machine("A", 1)
                .job("1", 1, "A")
                .job("1", 2, "A")
                .build());
    }

    @Test
    void jobShouldValidateItsFields() {
        assertThrows(IllegalArgumentException.class, () -> Job.of(" ", 1, "A"));
        assertThrows(IllegalArgumentException.class, () -> Job.of("1", 0, "A"));
        assertThrows(IllegalArgumentException.class, () -> Job.of("1", 1));
        assertThrows(IllegalArgumentException.class, () -> Job.of("1", 1, "A", "A"));
        assertThrows(IllegalArgumentException.class, () -> new Machine("A", 0));
    }

    @Test
    void jobMachinesShouldBeImmutable() {
        Job job = Job.of("1", 3, "A", "B");

        assertThrows(UnsupportedOperationException.class, () -> job.requiredMachines().add("C"));
        assertTrue(job.requiredMachines().contains("B"));
    }

    @Test
    void solveResultShouldRejectInconsistentState() {
        assertThrows(IllegalArgumentException.class, () -> new SolveResult(SolveStatus.SOLVED, null, null));
        assertThrows(IllegalStateException.class, () -> SolveResult.infeasible("none").makespan());
        assertTrue(SolveStatus.INFEASIBLE.retryMayHelp());
    }
}
