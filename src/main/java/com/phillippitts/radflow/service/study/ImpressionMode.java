package com.phillippitts.radflow.service.study;

/**
 * Impression search state.
 */
public enum ImpressionMode {
    /** Waiting for the generated impression after a process action; polled fast. */
    FAST,
    /** Impression found and pinned on the presentation surface until sign or discard. */
    FOUND,
    /** No search in progress. */
    IDLE
}
