package io.jobplan4j.solver.genetic;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class SwapMutationTest {

    private final SwapMutation mutation = new SwapMutation();

    @Test
    void fullRateShouldAlwaysSwapTwoPositions() {
        List<String> original = List.of("1", "2", "3", "4", "5");
        Random random = new Random(11);

        for (int i = 0; i < 100; i++) {
            List<String> individual = new ArrayList<>(original);
            mutation.mutate(individual, 1.0, random);

            assertNotEquals(original, individual);
            assertEquals(new HashSet<>(original), new HashSet<>(individual));
            int changed = 0;
            for (int k = 0; k < original.size(); k++) {
                if (!original.get(k).equals(individual.get(k))) {
                    changed++;
                }
            }
            assertEquals(2, changed);
        }
    }

    @Test
    void zeroRateShouldNeverMutate() {
        List<String> individual = new ArrayList<>(List.of("1", "2", "3"));

        for (int i = 0; i < 100; i++) {
            mutation.mutate(individual, 0.0, new Random(i));
        }

        assertEquals(List.of("1", "2", "3"), individual);
    }
}
