package io.jobplan4j.solver.genetic;

/**
 * Genetic optimizer parameters.
 * <ul>
 *   <li>populationSize: individuals per generation, at least 4 so that truncation leaves two parents</li>
 *   <li>generations: selection/crossover/mutation rounds; 0 evaluates only the initial population</li>
 *   <li>mutationRate: probability in [0, 1] that a child gets one swap</li>
 *   <li>seed: seed of the random generator, so runs are reproducible</li>
 * </ul>
 */
public record GeneticOptions(
        int populationSize,
        int generations,
        double mutationRate,
        long seed
) {
    public static final int MIN_POPULATION_SIZE = 4;

    public GeneticOptions {
        if (populationSize < MIN_POPULATION_SIZE) {
            throw new IllegalArgumentException("populationSize must be at least " + MIN_POPULATION_SIZE + ": " + populationSize);
        }
        if (generations < 0) {
            throw new IllegalArgumentException("generations must not be negative: " + generations);
        }
        if (Double.isNaN(mutationRate) || mutationRate < 0.0 || mutationRate > 1.0) {
            throw new IllegalArgumentException("mutationRate must be within [0, 1]: " + mutationRate);
        }
    }

    public static GeneticOptions defaults() {
        return new GeneticOptions(50, 100, 0.1, 42L);
    }

    public GeneticOptions withSeed(long seed) {
        return new GeneticOptions(populationSize, generations, mutationRate, seed);
    }
}
