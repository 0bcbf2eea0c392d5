package com.phillippitts.radflow.service.health;

import com.phillippitts.radflow.service.queue.ActionQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the action worker.
 *
 * <p>UP while the worker is running, DOWN once it has stopped. Exposed via /actuator/health.
 */
@Component
public class ActionQueueHealthIndicator implements HealthIndicator {

    private final ActionQueue queue;

    public ActionQueueHealthIndicator(ActionQueue queue) {
        this.queue = queue;
    }

    @Override
    public Health health() {
        Health.Builder builder = queue.isRunning() ? Health.up() : Health.down();
        return builder
                .withDetail("queueDepth", queue.depth())
                .withDetail("busy", queue.isBusy())
                .withDetail("executed", queue.executedCount())
                .build();
    }
}
