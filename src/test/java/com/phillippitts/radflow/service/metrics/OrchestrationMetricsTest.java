package com.phillippitts.radflow.service.metrics;

import com.phillippitts.radflow.domain.ActionKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationMetricsTest {

    @Test
    void recordsActionMetersTaggedByKind() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        OrchestrationMetrics metrics = new OrchestrationMetrics(registry);

        metrics.recordActionLatency(ActionKind.SIGN_REPORT, TimeUnit.MILLISECONDS.toNanos(120));
        metrics.incrementActionSuccess(ActionKind.SIGN_REPORT);
        metrics.incrementActionFailure(ActionKind.PROCESS_REPORT, "ActionExecutionException");
        metrics.incrementPollSkipped("busy");
        metrics.incrementPollSkipped("busy");

        assertThat(registry.get("radflow.action.latency").tag("action", "SIGN_REPORT").timer().count()).isEqualTo(1);
        assertThat(registry.get("radflow.action.success").tag("action", "SIGN_REPORT").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("radflow.action.failure")
                .tags("action", "PROCESS_REPORT", "reason", "ActionExecutionException").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("radflow.poll.skipped").tag("reason", "busy").counter().count()).isEqualTo(2.0);
    }
}
