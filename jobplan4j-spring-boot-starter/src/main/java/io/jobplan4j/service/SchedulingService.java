package io.jobplan4j.service;

import io.jobplan4j.Planner;
import io.jobplan4j.config.PlannerProperties;
import io.jobplan4j.core.PrecedenceRule;
import io.jobplan4j.core.Problem;
import io.jobplan4j.core.SolveResult;
import io.jobplan4j.core.SolverType;
import io.jobplan4j.internal.DefaultPlanner;
import io.jobplan4j.solver.genetic.GeneticOptions;
import io.jobplan4j.utils.ScheduleVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs solvers under a wall-clock budget.
 *
 * <p>Each solve runs on the worker pool and the caller waits at most {@code jobplan.solveTimeout};
 * past that the result is {@link io.jobplan4j.core.SolveStatus#TIMEOUT} and the worker is
 * interrupted. The backtracking search and the genetic generation loop check the interrupt flag
 * and give their thread back to the pool.
 *
 * <p>Typical usage:
 * <pre>{@code
 * SolveResult result = schedulingService.solve(problem, SolverType.BACKTRACKING);
 * Map<SolverType, SolveResult> all = schedulingService.compare(problem);
 * }</pre>
 */
public class SchedulingService {
    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private final PlannerProperties props;
    private final Function<Problem, Planner> plannerFactory;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ExecutorService workerPool;

    public SchedulingService(PlannerProperties props) {
        this(props, problem -> new DefaultPlanner(problem, props.getPrecedenceRule()));
    }

    public SchedulingService(PlannerProperties props, Function<Problem, Planner> plannerFactory) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.plannerFactory = Objects.requireNonNull(plannerFactory, "plannerFactory must not be null");
    }

    /**
     * Start the worker pool. Should be idempotent.
     */
    public void start() {
        if (started.get()) {
            return;
        }

        Duration timeout = Objects.requireNonNull(props.getSolveTimeout(), "jobplan.solveTimeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("jobplan.solveTimeout must be a positive duration");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("jobplan.maxConcurrency must be positive");
        }

        log.info("SchedulingService starting with solveTimeout={}, maxConcurrency={}, precedenceRule={}, timeHorizon={}",
                props.getSolveTimeout(),
                props.getMaxConcurrency(),
                props.getPrecedenceRule(),
                props.getTimeHorizon());

        if (!started.compareAndSet(false, true)) {
            return;
        }
        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("jobplan.solver");
            t.setDaemon(true);
            return t;
        });
        log.info("SchedulingService started successfully.");
    }

    /**
     * Stop the worker pool. Should be idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("SchedulingService stopping...");
        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.shutdownNow();
            try {
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("SchedulingService stopped with solver threads still running");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("SchedulingService stopped successfully.");
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Run one solver with the configured parameters and wall-clock budget.
     */
    public SolveResult solve(Problem problem, SolverType type) {
        Objects.requireNonNull(problem, "problem must not be null");
        Objects.requireNonNull(type, "type must not be null");

        Future<SolveResult> future = submit(problem, type);
        long deadline = System.nanoTime() + props.getSolveTimeout().toNanos();
        return await(type, future, deadline);
    }

    /**
     * Run every solver in parallel on the same problem, each with its own planner and machine
     * state, under one shared wall-clock budget.
     */
    public Map<SolverType, SolveResult> compare(Problem problem) {
        Objects.requireNonNull(problem, "problem must not be null");

        Map<SolverType, Future<SolveResult>> futures = new EnumMap<>(SolverType.class);
        for (SolverType type : SolverType.values()) {
            futures.put(type, submit(problem, type));
        }

        long deadline = System.nanoTime() + props.getSolveTimeout().toNanos();
        Map<SolverType, SolveResult> results = new EnumMap<>(SolverType.class);
        for (Map.Entry<SolverType, Future<SolveResult>> e : futures.entrySet()) {
            results.put(e.getKey(), await(e.getKey(), e.getValue(), deadline));
        }
        return results;
    }

    private Future<SolveResult> submit(Problem problem, SolverType type) {
        ExecutorService pool = workerPool;
        if (!started.get() || pool == null) {
            throw new IllegalStateException("SchedulingService is not started");
        }
        Planner planner = plannerFactory.apply(problem);
        return pool.submit(() -> run(planner, type));
    }

    private SolveResult run(Planner planner, SolverType type) {
        long startedAt = System.nanoTime();
        SolveResult result = switch (type) {
            case LIST -> planner.runListSchedule();
            case GENETIC -> planner.runGenetic(geneticOptions());
            case BACKTRACKING -> planner.runBacktracking(props.getTimeHorizon());
        };
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        if (result.isSolved()) {
            log.info("Solver finished type={} status={} makespan={} elapsedMs={}",
                    type, result.status(), result.makespan(), elapsedMs);
            verify(planner.problem(), type, result);
        } else {
            log.warn("Solver finished type={} status={} msg={} elapsedMs={}",
                    type, result.status(), result.message(), elapsedMs);
        }
        return result;
    }

    private SolveResult await(SolverType type, Future<SolveResult> future, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Solver exceeded wall-clock budget type={} solveTimeout={}", type, props.getSolveTimeout());
            return SolveResult.timeout(type + " solver exceeded " + props.getSolveTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SolveResult.timeout(type + " solver interrupted while waiting");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Solver failed type={} msg={}", type, cause.getMessage(), cause);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(type + " solver failed", cause);
        }
    }

    private GeneticOptions geneticOptions() {
        long seed;
        if (props.getSeed() != null) {
            seed = props.getSeed();
        } else {
            seed = ThreadLocalRandom.current().nextLong();
            log.info("Genetic run using generated seed={}", seed);
        }
        return new GeneticOptions(props.getPopulationSize(), props.getGenerations(), props.getMutationRate(), seed);
    }

    private void verify(Problem problem, SolverType type, SolveResult result) {
        PrecedenceRule rule = type == SolverType.BACKTRACKING ? PrecedenceRule.COMPLETION : props.getPrecedenceRule();
        List<String> violations = ScheduleVerifier.violations(problem, result.schedule(), rule);
        if (!violations.isEmpty()) {
            log.error("Solver returned an invalid schedule type={} violations={}", type, violations);
        }
    }
}
