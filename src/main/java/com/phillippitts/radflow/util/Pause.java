package com.phillippitts.radflow.util;

/**
 * Blocking pause used between steps of an external-application interaction
 * (window activation latency, clipboard settling). Tests inject a no-op.
 */
@FunctionalInterface
public interface Pause {

    /** Pause that sleeps the calling thread, restoring the interrupt flag if interrupted. */
    Pause SLEEP = millis -> {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    };

    /** Pause that returns immediately. */
    Pause NONE = millis -> { };

    void pause(long millis);
}
