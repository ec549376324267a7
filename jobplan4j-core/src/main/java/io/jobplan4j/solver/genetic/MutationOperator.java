package io.jobplan4j.solver.genetic;

import java.util.List;
import java.util.Random;

/**
 * Mutates an order in place.
 */
public interface MutationOperator {
    void mutate(List<String> individual, double mutationRate, Random random);
}
