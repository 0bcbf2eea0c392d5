package com.phillippitts.radflow.service.queue.event;

import com.phillippitts.radflow.domain.ActionRequest;

import java.time.Instant;

/**
 * Published by any component that wants an action run on the action worker.
 * The queue appends it; publishers never wait for execution.
 */
public record ActionRequestedEvent(ActionRequest request, Instant at) { }
