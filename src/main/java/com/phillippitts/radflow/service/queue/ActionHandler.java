package com.phillippitts.radflow.service.queue;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;

import java.util.Set;

/**
 * Executes one or more action kinds on the action worker thread.
 *
 * <p>Handlers run strictly one at a time and may block with short pauses while waiting for
 * the external application. Throwing is allowed; the worker logs the failure, shows a toast
 * and moves on.
 */
public interface ActionHandler {

    /** Action kinds this handler executes. Each kind has exactly one handler. */
    Set<ActionKind> kinds();

    void handle(ActionRequest request);
}
