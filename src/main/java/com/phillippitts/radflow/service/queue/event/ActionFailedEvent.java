package com.phillippitts.radflow.service.queue.event;

import com.phillippitts.radflow.domain.ActionKind;

import java.time.Instant;

/**
 * Published when an action threw inside the worker.
 */
public record ActionFailedEvent(ActionKind kind, String source, String reason, Instant at) { }
