package com.phillippitts.radflow.service.hotkey;

/**
 * Matches one configured hotkey against normalized key events. Implementations keep only
 * "is held" state so key repeat fires once.
 */
public interface HotkeyTrigger {
    /** Human-readable name for logs. */
    String name();

    /** @return true if this press fires the hotkey */
    boolean onKeyPressed(NormalizedKeyEvent e);

    /** @return true if this release ends a press that fired */
    boolean onKeyReleased(NormalizedKeyEvent e);
}
