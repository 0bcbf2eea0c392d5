package com.phillippitts.radflow.service.study;

import com.phillippitts.radflow.service.study.event.ImpressionSearchChangedEvent;
import com.phillippitts.radflow.testutil.EventCapturingPublisher;
import com.phillippitts.radflow.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ImpressionSearchTest {

    private static final Duration SETTLE = Duration.ofMillis(2000);

    private final MutableClock clock = new MutableClock();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final ImpressionSearch search = new ImpressionSearch(clock, publisher);

    @Test
    void startsIdle() {
        assertThat(search.mode()).isEqualTo(ImpressionMode.IDLE);
        assertThat(search.isActive()).isFalse();
        assertThat(search.startedAt()).isNull();
    }

    @Test
    void impressionIsIgnoredUntilSettleTimeHasPassed() {
        // Arrange
        search.begin();

        // Act
        boolean early = search.tryMarkFound("1. No acute findings.", SETTLE);
        clock.advanceMillis(1999);
        boolean stillEarly = search.tryMarkFound("1. No acute findings.", SETTLE);
        clock.advanceMillis(1);
        boolean found = search.tryMarkFound("1. No acute findings.", SETTLE);

        // Assert
        assertThat(early).isFalse();
        assertThat(stillEarly).isFalse();
        assertThat(found).isTrue();
        assertThat(search.mode()).isEqualTo(ImpressionMode.FOUND);
    }

    @Test
    void blankImpressionNeverCounts() {
        // Arrange
        search.begin();
        clock.advance(SETTLE);

        // Act / Assert
        assertThat(search.tryMarkFound("  ", SETTLE)).isFalse();
        assertThat(search.tryMarkFound(null, SETTLE)).isFalse();
        assertThat(search.mode()).isEqualTo(ImpressionMode.FAST);
    }

    @Test
    void foundOnlyOnceAndNeverWhileIdle() {
        // Arrange
        search.begin();
        clock.advance(SETTLE);
        search.tryMarkFound("x", SETTLE);

        // Act / Assert
        assertThat(search.tryMarkFound("y", SETTLE)).isFalse();
        search.end();
        assertThat(search.tryMarkFound("y", SETTLE)).isFalse();
    }

    @Test
    void publishesEveryModeChangeAndIgnoresRedundantEnd() {
        // Arrange
        search.begin();
        clock.advance(SETTLE);
        search.tryMarkFound("x", SETTLE);

        // Act
        search.end();
        search.end();

        // Assert
        assertThat(publisher.eventsOfType(ImpressionSearchChangedEvent.class))
                .extracting(ImpressionSearchChangedEvent::mode)
                .containsExactly(ImpressionMode.FAST, ImpressionMode.FOUND, ImpressionMode.IDLE);
    }
}
