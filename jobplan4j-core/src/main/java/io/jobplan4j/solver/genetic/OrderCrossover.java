package io.jobplan4j.solver.genetic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * One-point order-preserving crossover.
 *
 * <p>The child takes parent 1 up to a cut point in [1, n-1], then the genes of parent 2 that
 * are not in that prefix, in parent 2's relative order. The child never has duplicates or gaps.
 */
public class OrderCrossover implements CrossoverOperator {

    @Override
    public List<String> crossover(List<String> parent1, List<String> parent2, Random random) {
        Objects.requireNonNull(parent1, "parent1 must not be null");
        Objects.requireNonNull(parent2, "parent2 must not be null");
        if (parent1.size() != parent2.size()) {
            throw new IllegalArgumentException("parents must have the same length");
        }

        int n = parent1.size();
        if (n < 2) {
            return new ArrayList<>(parent1);
        }

        int cut = 1 + random.nextInt(n - 1);
        List<String> child = new ArrayList<>(n);
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < cut; i++) {
            String gene = parent1.get(i);
            child.add(gene);
            taken.add(gene);
        }
        for (String gene : parent2) {
            if (taken.add(gene)) {
                child.add(gene);
            }
        }

        if (child.size() != n) {
            throw new IllegalArgumentException("parents are not permutations of the same genes");
        }
        return child;
    }
}
