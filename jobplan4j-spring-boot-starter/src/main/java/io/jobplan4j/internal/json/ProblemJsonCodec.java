package io.jobplan4j.internal.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobplan4j.ProblemBuilder;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.ScheduledJob;
import io.jobplan4j.core.SolveResult;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Reads problems from JSON and writes solve results back.
 *
 * <p>Structural errors (ids, references, values out of range) are reported by the core model as
 * {@link IllegalArgumentException}; malformed JSON is wrapped in one as well.
 */
public class ProblemJsonCodec {

    private final ObjectMapper objectMapper;

    public ProblemJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Problem read(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return toProblem(reader().readValue(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid problem JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Problem read(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return toProblem(reader().readValue(in));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid problem JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Convert a document into a validated problem. Per-job {@code dependsOn} entries are added
     * after the top-level {@code dependencies}.
     */
    public Problem toProblem(ProblemDocument doc) {
        if (doc == null) {
            throw new IllegalArgumentException("Invalid problem JSON: empty document");
        }

        ProblemBuilder builder = Problem.builder();
        for (ProblemDocument.MachineEntry m : nullToEmpty(doc.getMachines())) {
            builder.machine(m.getId(), m.getCapacity());
        }
        for (ProblemDocument.JobEntry j : nullToEmpty(doc.getJobs())) {
            builder.job(j.getId(), j.getProcessingTime(), nullToEmpty(j.getRequiredMachines()));
        }
        for (ProblemDocument.DependencyEntry d : nullToEmpty(doc.getDependencies())) {
            builder.dependency(d.getPredecessor(), d.getSuccessor());
        }
        for (ProblemDocument.JobEntry j : nullToEmpty(doc.getJobs())) {
            List<String> preds = nullToEmpty(j.getDependsOn());
            if (!preds.isEmpty()) {
                builder.dependsOn(j.getId(), preds.toArray(String[]::new));
            }
        }
        return builder.build();
    }

    /**
     * Render a result as JSON: status, message, and for solved results the makespan and one
     * entry per placed job in schedule order.
     */
    public String write(SolveResult result) {
        Objects.requireNonNull(result, "result must not be null");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("status", result.status().name());
        if (result.message() != null) {
            root.put("message", result.message());
        }
        if (result.isSolved()) {
            root.put("makespan", result.makespan());
            ArrayNode jobs = root.putArray("jobs");
            for (ScheduledJob sj : result.schedule().jobs()) {
                ObjectNode node = jobs.addObject();
                node.put("id", sj.jobId());
                node.put("start", sj.start());
                node.put("end", sj.end());
                ArrayNode machines = node.putArray("machines");
                sj.machines().forEach(machines::add);
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render solve result", e);
        }
    }

    private ObjectReader reader() {
        return objectMapper.readerFor(ProblemDocument.class).with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
