package com.phillippitts.radflow.service.events;

import com.phillippitts.radflow.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorEventsListenerTest {

    @Test
    void throttlesPerKeyForOneMinute() {
        // Arrange
        MutableClock clock = new MutableClock();
        ErrorEventsListener listener = new ErrorEventsListener(clock);

        // Act / Assert
        assertThat(listener.shouldLog("hotkey-permission")).isTrue();
        assertThat(listener.shouldLog("hotkey-permission")).isFalse();
        assertThat(listener.shouldLog("action-SIGN_REPORT-boom")).isTrue();

        clock.advance(Duration.ofSeconds(60));
        assertThat(listener.shouldLog("hotkey-permission")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(listener.shouldLog("hotkey-permission")).isTrue();
    }
}
