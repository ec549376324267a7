package io.jobplan4j.solver.genetic;

import java.util.List;
import java.util.Random;

/**
 * Combines two parent orders into a child order.
 */
public interface CrossoverOperator {
    /**
     * @param parent1 first parent, not modified
     * @param parent2 second parent, not modified
     * @param random  source of all randomness for this operation
     * @return a new, mutable child that is a permutation of the parents' genes
     */
    List<String> crossover(List<String> parent1, List<String> parent2, Random random);
}
