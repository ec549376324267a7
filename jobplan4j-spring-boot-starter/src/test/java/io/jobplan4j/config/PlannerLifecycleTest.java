package io.jobplan4j.config;

import io.jobplan4j.service.SchedulingService;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class PlannerLifecycleTest {

    @Test
    void runningStateShouldFollowTheService() {
        SchedulingService service = new SchedulingService(new PlannerProperties());
        PlannerLifecycle lifecycle = new PlannerLifecycle(service);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        service.stop();
        assertThat(lifecycle.isRunning()).isFalse();

        service.start();
        assertThat(lifecycle.isRunning()).isTrue();
        lifecycle.stop();
        assertThat(service.isStarted()).isFalse();
    }

    @Test
    void stopCallbackShouldRunAfterShutdown() {
        SchedulingService service = new SchedulingService(new PlannerProperties());
        PlannerLifecycle lifecycle = new PlannerLifecycle(service);
        lifecycle.start();
        AtomicBoolean called = new AtomicBoolean();

        lifecycle.stop(() -> called.set(!service.isStarted()));

        assertThat(called).isTrue();
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
