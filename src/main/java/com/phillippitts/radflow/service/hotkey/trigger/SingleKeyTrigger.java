package com.phillippitts.radflow.service.hotkey.trigger;

import com.phillippitts.radflow.service.hotkey.HotkeyTrigger;
import com.phillippitts.radflow.service.hotkey.NormalizedKeyEvent;

/**
 * Matches a single key pressed with no modifiers held, ignoring key-repeat.
 */
public final class SingleKeyTrigger implements HotkeyTrigger {

    private final String key;
    private boolean held;

    public SingleKeyTrigger(String key) {
        this.key = key;
    }

    @Override
    public String name() {
        return "single-key:" + key;
    }

    @Override
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held || !e.key().equals(key) || !e.modifiers().isEmpty()) {
            return false;
        }
        held = true;
        return true;
    }

    @Override
    public boolean onKeyReleased(NormalizedKeyEvent e) {
        if (held && e.key().equals(key)) {
            held = false;
            return true;
        }
        return false;
    }
}
