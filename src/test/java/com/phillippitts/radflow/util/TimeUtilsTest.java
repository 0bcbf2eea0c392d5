package com.phillippitts.radflow.util;

import com.phillippitts.radflow.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0);
    }

    @Test
    void hasElapsedAtWindowBoundary() {
        MutableClock clock = new MutableClock();
        Instant since = clock.instant();

        assertThat(TimeUtils.hasElapsed(clock, since, Duration.ofSeconds(2))).isFalse();
        clock.advanceMillis(1999);
        assertThat(TimeUtils.hasElapsed(clock, since, Duration.ofSeconds(2))).isFalse();
        clock.advanceMillis(1);
        assertThat(TimeUtils.hasElapsed(clock, since, Duration.ofSeconds(2))).isTrue();
    }

    @Test
    void nullStartCountsAsElapsed() {
        assertThat(TimeUtils.hasElapsed(new MutableClock(), null, Duration.ofHours(1))).isTrue();
    }
}
