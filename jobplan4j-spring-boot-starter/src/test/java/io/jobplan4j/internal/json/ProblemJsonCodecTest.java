package io.jobplan4j.internal.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobplan4j.core.Dependency;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.core.UnknownReferenceException;
import io.jobplan4j.internal.DefaultPlanner;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProblemJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProblemJsonCodec codec = new ProblemJsonCodec(objectMapper);

    @Test
    void readsFixtureWithBothDependencyForms() throws Exception {
        Problem problem;
        try (InputStream in = getClass().getResourceAsStream("/workshop.json")) {
            problem = codec.read(in);
        }

        assertEquals(List.of("1", "2", "3", "4", "5"), problem.jobIds());
        assertEquals(List.of("A", "B", "C"), problem.machineIds());
        assertEquals(List.of("A", "B"), problem.job("4").requiredMachines());
        assertTrue(problem.dependencies().contains(new Dependency("1", "4")));
        assertTrue(problem.dependencies().contains(new Dependency("2", "5")));
        assertTrue(problem.dependencies().contains(new Dependency("3", "5")));
        assertEquals(3, problem.dependencies().size());
    }

    @Test
    void machineCapacityDefaultsToOne() {
        Problem problem = codec.read("""
                {"machines": [{"id": "M"}],
                 "jobs": [{"id": "j", "processingTime": 2, "requiredMachines": ["M"]}]}
                """);

        assertEquals(1, problem.machines().get(0).capacity());
        assertTrue(problem.dependencies().isEmpty());
    }

    @Test
    void malformedJsonIsIllegalArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> codec.read("{\"jobs\": ["));
        assertTrue(e.getMessage().startsWith("Invalid problem JSON"));
    }

    @Test
    void unknownFieldIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.read("{\"workers\": []}"));
    }

    @Test
    void unknownMachineReferenceIsReported() {
        UnknownReferenceException e = assertThrows(UnknownReferenceException.class, () -> codec.read("""
                {"machines": [{"id": "A"}],
                 "jobs": [{"id": "1", "processingTime": 1, "requiredMachines": ["Z"]}]}
                """));
        assertEquals("Z", e.reference());
    }

    @Test
    void unknownDependsOnReferenceIsReported() {
        assertThrows(UnknownReferenceException.class, () -> codec.read("""
                {"machines": [{"id": "A"}],
                 "jobs": [{"id": "1", "processingTime": 1, "requiredMachines": ["A"], "dependsOn": ["ghost"]}]}
                """));
    }

    @Test
    void writesSolvedResult() throws Exception {
        Problem problem;
        try (InputStream in = getClass().getResourceAsStream("/workshop.json")) {
            problem = codec.read(in);
        }
        SolveResult result = new DefaultPlanner(problem).runListSchedule();

        JsonNode root = objectMapper.readTree(codec.write(result));

        assertEquals("SOLVED", root.get("status").asText());
        assertEquals(18, root.get("makespan").asLong());
        assertFalse(root.has("message"));
        assertEquals(5, root.get("jobs").size());
        JsonNode fifth = root.get("jobs").get(4);
        assertEquals("5", fifth.get("id").asText());
        assertEquals(14, fifth.get("start").asLong());
        assertEquals(18, fifth.get("end").asLong());
        assertEquals("B", fifth.get("machines").get(0).asText());
    }

    @Test
    void writesFailureWithoutSchedule() throws Exception {
        JsonNode root = objectMapper.readTree(codec.write(SolveResult.infeasible("no room before 5")));

        assertEquals("INFEASIBLE", root.get("status").asText());
        assertEquals("no room before 5", root.get("message").asText());
        assertFalse(root.has("jobs"));
        assertFalse(root.has("makespan"));
    }

    @Test
    void nullDocumentIsIllegalArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> codec.read("null"));
        assertEquals("Invalid problem JSON: empty document", e.getMessage());
    }
}
