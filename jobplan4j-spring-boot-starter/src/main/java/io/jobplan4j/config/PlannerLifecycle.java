package io.jobplan4j.config;

import io.jobplan4j.service.SchedulingService;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges the scheduling service's worker pool with the Spring container lifecycle.
 */
public class PlannerLifecycle implements SmartLifecycle {
    private final SchedulingService schedulingService;

    public PlannerLifecycle(SchedulingService schedulingService) {
        this.schedulingService = Objects.requireNonNull(schedulingService, "schedulingService must not be null");
    }

    @Override
    public void start() {
        schedulingService.start();
    }

    @Override
    public void stop() {
        schedulingService.stop();
    }

    /**
     * Stops the worker pool on the caller's thread; it waits for interrupted solvers to unwind.
     */
    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return schedulingService.isStarted();
    }

    // Last to start and first to stop, after anything that submits problems.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
