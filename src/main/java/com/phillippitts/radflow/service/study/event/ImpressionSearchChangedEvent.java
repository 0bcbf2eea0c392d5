package com.phillippitts.radflow.service.study.event;

import com.phillippitts.radflow.service.study.ImpressionMode;

import java.time.Instant;
import java.util.Objects;

/**
 * Published whenever the impression search changes mode, so the poller can re-arm at the
 * matching interval.
 */
public record ImpressionSearchChangedEvent(ImpressionMode mode, Instant at) {
    public ImpressionSearchChangedEvent {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(at, "at");
    }
}
