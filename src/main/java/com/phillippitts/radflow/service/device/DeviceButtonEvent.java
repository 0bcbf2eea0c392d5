package com.phillippitts.radflow.service.device;

import java.time.Instant;

/**
 * A dictation microphone button was pressed. {@code button} is the name the device bridge
 * reports, e.g. {@code Skip Back}.
 */
public record DeviceButtonEvent(String button, Instant at) { }
