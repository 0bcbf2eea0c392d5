package com.phillippitts.radflow.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the action worker.
 */
@ConfigurationProperties(prefix = "actions")
@Validated
public class ActionQueueProperties {

    /** How long the idle worker waits for a signal before waking on its own. */
    @Positive(message = "Idle wake must be positive")
    private long idleWakeMs = 500;

    /** Upper bound for joining the worker on shutdown. */
    @Positive(message = "Shutdown join timeout must be positive")
    private long shutdownJoinMs = 500;

    /** Restore the previously focused external window after each action. */
    private boolean restoreFocusAfterAction = false;

    /** Pause after releasing held modifiers for hotkey-sourced actions. */
    @Min(0)
    private long modifierReleasePauseMs = 50;

    /** Duration of the toast shown when an action fails. */
    @Positive
    private int errorToastMs = 3000;

    public long getIdleWakeMs() {
        return idleWakeMs;
    }

    public void setIdleWakeMs(long idleWakeMs) {
        this.idleWakeMs = idleWakeMs;
    }

    public long getShutdownJoinMs() {
        return shutdownJoinMs;
    }

    public void setShutdownJoinMs(long shutdownJoinMs) {
        this.shutdownJoinMs = shutdownJoinMs;
    }

    public boolean isRestoreFocusAfterAction() {
        return restoreFocusAfterAction;
    }

    public void setRestoreFocusAfterAction(boolean restoreFocusAfterAction) {
        this.restoreFocusAfterAction = restoreFocusAfterAction;
    }

    public long getModifierReleasePauseMs() {
        return modifierReleasePauseMs;
    }

    public void setModifierReleasePauseMs(long modifierReleasePauseMs) {
        this.modifierReleasePauseMs = modifierReleasePauseMs;
    }

    public int getErrorToastMs() {
        return errorToastMs;
    }

    public void setErrorToastMs(int errorToastMs) {
        this.errorToastMs = errorToastMs;
    }
}
