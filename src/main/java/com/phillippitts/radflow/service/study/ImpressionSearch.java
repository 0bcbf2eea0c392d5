package com.phillippitts.radflow.service.study;

import com.phillippitts.radflow.service.study.event.ImpressionSearchChangedEvent;
import com.phillippitts.radflow.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Two-speed search for the impression the reporting app generates after "process".
 *
 * <p>{@link #begin()} enters {@link ImpressionMode#FAST}. The poller calls
 * {@link #tryMarkFound(String, Duration)} each cycle; text is only accepted once the settle
 * time has passed since the search began, since the app briefly shows the previous draft.
 * Sign, discard and a case change call {@link #end()}.
 */
@Component
public class ImpressionSearch {

    private static final Logger LOG = LogManager.getLogger(ImpressionSearch.class);

    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private ImpressionMode mode = ImpressionMode.IDLE;
    private Instant startedAt;

    public ImpressionSearch(Clock clock, ApplicationEventPublisher publisher) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    public void begin() {
        synchronized (this) {
            mode = ImpressionMode.FAST;
            startedAt = clock.instant();
        }
        LOG.debug("Impression search started");
        publish(ImpressionMode.FAST);
    }

    /**
     * @return true if this call moved the search from FAST to FOUND
     */
    public boolean tryMarkFound(String impression, Duration settle) {
        synchronized (this) {
            if (mode != ImpressionMode.FAST || impression == null || impression.isBlank()) {
                return false;
            }
            if (!TimeUtils.hasElapsed(clock, startedAt, settle)) {
                return false;
            }
            mode = ImpressionMode.FOUND;
        }
        LOG.info("Impression found");
        publish(ImpressionMode.FOUND);
        return true;
    }

    public void end() {
        synchronized (this) {
            if (mode == ImpressionMode.IDLE) {
                return;
            }
            mode = ImpressionMode.IDLE;
            startedAt = null;
        }
        publish(ImpressionMode.IDLE);
    }

    public synchronized ImpressionMode mode() {
        return mode;
    }

    public synchronized boolean isActive() {
        return mode != ImpressionMode.IDLE;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    private void publish(ImpressionMode newMode) {
        publisher.publishEvent(new ImpressionSearchChangedEvent(newMode, clock.instant()));
    }
}
