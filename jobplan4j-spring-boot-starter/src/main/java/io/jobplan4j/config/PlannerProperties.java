package io.jobplan4j.config;

import io.jobplan4j.core.PrecedenceRule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the scheduling service.
 */
@ConfigurationProperties(prefix = "jobplan")
public class PlannerProperties {
    private PrecedenceRule precedenceRule = PrecedenceRule.COMPLETION; // list + genetic
    private int populationSize = 50;
    private int generations = 100;
    private double mutationRate = 0.1;
    private Long seed; // null: fresh seed per run, logged
    private long timeHorizon = 100; // backtracking window
    private Duration solveTimeout = Duration.ofSeconds(30);
    private int maxConcurrency = 3;

    public PrecedenceRule getPrecedenceRule() {
        return precedenceRule;
    }

    public void setPrecedenceRule(PrecedenceRule precedenceRule) {
        this.precedenceRule = precedenceRule;
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public void setPopulationSize(int populationSize) {
        this.populationSize = populationSize;
    }

    public int getGenerations() {
        return generations;
    }

    public void setGenerations(int generations) {
        this.generations = generations;
    }

    public double getMutationRate() {
        return mutationRate;
    }

    public void setMutationRate(double mutationRate) {
        this.mutationRate = mutationRate;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public long getTimeHorizon() {
        return timeHorizon;
    }

    public void setTimeHorizon(long timeHorizon) {
        this.timeHorizon = timeHorizon;
    }

    public Duration getSolveTimeout() {
        return solveTimeout;
    }

    public void setSolveTimeout(Duration solveTimeout) {
        this.solveTimeout = solveTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }
}
