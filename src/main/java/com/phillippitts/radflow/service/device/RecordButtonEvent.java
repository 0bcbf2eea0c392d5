package com.phillippitts.radflow.service.device;

import java.time.Instant;

/**
 * Record button state change, reported separately so push-to-talk sees both edges.
 */
public record RecordButtonEvent(boolean pressed, Instant at) { }
