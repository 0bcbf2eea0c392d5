package com.phillippitts.radflow.service.metrics;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.TerminalOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the action worker and the pollers.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Action latency and success/failure per action kind</li>
 *   <li>Study poll cycles skipped or abandoned, by reason</li>
 *   <li>Terminal case notifications by outcome</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "radflow";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one action held the worker, including cleanup.
     *
     * @param kind action kind
     * @param durationNanos duration in nanoseconds
     */
    public void recordActionLatency(ActionKind kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".action.latency")
                .description("Time an action held the action worker")
                .tag("action", kind.name())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementActionSuccess(ActionKind kind) {
        Counter.builder(METRIC_PREFIX + ".action.success")
                .description("Number of actions completed without error")
                .tag("action", kind.name())
                .register(registry)
                .increment();
    }

    /**
     * @param reason exception simple name
     */
    public void incrementActionFailure(ActionKind kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".action.failure")
                .description("Number of actions that threw")
                .tag("action", kind.name())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason busy, probe-failed or unknown
     */
    public void incrementPollSkipped(String reason) {
        Counter.builder(METRIC_PREFIX + ".poll.skipped")
                .description("Study poll cycles skipped or abandoned")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTerminal(TerminalOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".case.terminal")
                .description("Terminal notifications emitted for closed cases")
                .tag("outcome", outcome.wireName())
                .register(registry)
                .increment();
    }
}
