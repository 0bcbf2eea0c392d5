package com.phillippitts.radflow.service.external;

/**
 * Side effects against the reporting application. Only the action worker calls this.
 */
public interface ExternalCommander {

    /**
     * Sends the keystroke configured for {@code command} to the focused window.
     *
     * @return false if the command is not configured or input injection is unavailable
     */
    boolean emitKeystroke(ExternalCommand command);

    /** Brings the reporting application to the foreground. */
    void activateExternalApp();

    /** Releases any modifier keys still held from the hotkey that triggered the action. */
    void releaseModifiers();

    /** Gives focus back to whatever window had it before the action. */
    void restorePreviousFocus();
}
