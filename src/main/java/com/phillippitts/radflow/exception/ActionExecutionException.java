package com.phillippitts.radflow.exception;

import com.phillippitts.radflow.domain.ActionKind;

/**
 * Thrown when an action body fails inside the action worker.
 * The worker catches it, logs it and surfaces a toast; the loop keeps running.
 */
public class ActionExecutionException extends RadFlowException {

    private final ActionKind kind;

    public ActionExecutionException(ActionKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionExecutionException(ActionKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ActionKind getKind() {
        return kind;
    }
}
