package io.jobplan4j.solver.genetic;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * With probability {@code mutationRate}, swaps two distinct random positions.
 */
public class SwapMutation implements MutationOperator {

    @Override
    public void mutate(List<String> individual, double mutationRate, Random random) {
        int n = individual.size();
        if (n < 2) {
            return;
        }
        if (random.nextDouble() >= mutationRate) {
            return;
        }
        int i = random.nextInt(n);
        int j = random.nextInt(n - 1);
        if (j >= i) {
            j++;
        }
        Collections.swap(individual, i, j);
    }
}
