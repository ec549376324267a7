package io.jobplan4j.solver.genetic;

import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.graph.DependencyGraph;
import io.jobplan4j.solver.Evaluation;
import io.jobplan4j.solver.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Population search over job orders.
 *
 * <p>Each generation: evaluate every individual, keep the better half (elitist truncation),
 * then breed exactly {@code populationSize} children from random pairs of distinct survivors
 * by crossover and mutation. The children replace the whole population; survivors only live
 * on through their offspring. The run stops after a fixed number of generations.
 *
 * <p>An interrupt of the running thread ends the run at the next generation boundary; the
 * result then covers the generations completed so far and {@link GeneticResult#interrupted()}
 * is set.
 *
 * <p>Orders that break precedence are not errors, they score {@link Evaluation#INFEASIBLE_FITNESS}
 * and fall out at selection.
 */
public class GeneticOptimizer {
    private static final Logger log = LoggerFactory.getLogger(GeneticOptimizer.class);

    private final GeneticOptions options;
    private final CrossoverOperator crossover;
    private final MutationOperator mutation;

    public GeneticOptimizer(GeneticOptions options) {
        this(options, new OrderCrossover(), new SwapMutation());
    }

    public GeneticOptimizer(GeneticOptions options, CrossoverOperator crossover, MutationOperator mutation) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.crossover = Objects.requireNonNull(crossover, "crossover must not be null");
        this.mutation = Objects.requireNonNull(mutation, "mutation must not be null");
    }

    /**
     * Optimize with a generator seeded from {@link GeneticOptions#seed()}.
     */
    public GeneticResult optimize(Problem problem, DependencyGraph graph, PrecedenceRule rule) {
        return optimize(problem, graph, rule, new Random(options.seed()));
    }

    public GeneticResult optimize(Problem problem, DependencyGraph graph, PrecedenceRule rule, Random random) {
        Objects.requireNonNull(problem, "problem must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(random, "random must not be null");

        ScheduleEvaluator evaluator = new ScheduleEvaluator(problem, graph, rule);
        int populationSize = options.populationSize();
        int survivorCount = populationSize / 2;

        log.info("Genetic optimization starting jobs={} populationSize={} generations={} mutationRate={}",
                problem.jobCount(), populationSize, options.generations(), options.mutationRate());

        List<List<String>> population = new ArrayList<>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            List<String> individual = new ArrayList<>(problem.jobIds());
            Collections.shuffle(individual, random);
            population.add(individual);
        }

        List<Long> history = new ArrayList<>(options.generations() + 1);
        long bestSeen = Evaluation.INFEASIBLE_FITNESS;
        boolean interrupted = false;

        for (int generation = 0; generation < options.generations(); generation++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Genetic optimization interrupted generation={} of {}", generation, options.generations());
                interrupted = true;
                break;
            }
            List<Evaluation> ranked = rank(evaluator, population);
            bestSeen = Math.min(bestSeen, ranked.get(0).fitness());
            history.add(bestSeen);

            List<List<String>> survivors = new ArrayList<>(survivorCount);
            for (int i = 0; i < survivorCount; i++) {
                survivors.add(ranked.get(i).order());
            }

            List<List<String>> children = new ArrayList<>(populationSize);
            while (children.size() < populationSize) {
                int a = random.nextInt(survivorCount);
                int b = random.nextInt(survivorCount - 1);
                if (b >= a) {
                    b++;
                }
                List<String> child = crossover.crossover(survivors.get(a), survivors.get(b), random);
                mutation.mutate(child, options.mutationRate(), random);
                children.add(child);
            }
            population = children;

            log.debug("Genetic generation={} best={} bestSeen={}", generation, ranked.get(0).fitness(), bestSeen);
        }

        List<Evaluation> finalRanked = rank(evaluator, population);
        Evaluation best = finalRanked.get(0);
        bestSeen = Math.min(bestSeen, best.fitness());
        history.add(bestSeen);

        if (best.feasible()) {
            log.info("Genetic optimization finished bestMakespan={} bestSeen={}", best.makespan(), bestSeen);
        } else {
            log.warn("Genetic optimization finished with no feasible individual in the final population, populationSize={}",
                    populationSize);
        }
        return new GeneticResult(best.order(), best, history, interrupted);
    }

    public GeneticOptions options() {
        return options;
    }

    // Stable sort, so ties keep population order.
    private static List<Evaluation> rank(ScheduleEvaluator evaluator, List<List<String>> population) {
        List<Evaluation> evaluations = new ArrayList<>(population.size());
        for (List<String> individual : population) {
            evaluations.add(evaluator.evaluate(individual));
        }
        evaluations.sort(Comparator.comparingLong(Evaluation::fitness));
        return evaluations;
    }
}
