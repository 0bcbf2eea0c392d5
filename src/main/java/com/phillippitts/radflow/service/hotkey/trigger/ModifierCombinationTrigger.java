package com.phillippitts.radflow.service.hotkey.trigger;

import com.phillippitts.radflow.service.hotkey.HotkeyTrigger;
import com.phillippitts.radflow.service.hotkey.NormalizedKeyEvent;

import java.util.Set;

/**
 * Matches a combination like CONTROL+SHIFT+P. The held modifiers must be exactly the
 * configured ones, so CONTROL+P does not also fire on CONTROL+SHIFT+P.
 */
public final class ModifierCombinationTrigger implements HotkeyTrigger {

    private final String primaryKey;
    private final Set<String> requiredModifiers;
    private boolean held;

    public ModifierCombinationTrigger(Set<String> modifiers, String primaryKey) {
        this.primaryKey = primaryKey;
        this.requiredModifiers = Set.copyOf(modifiers);
    }

    @Override
    public String name() {
        return "combo:" + String.join("+", requiredModifiers) + "+" + primaryKey;
    }

    @Override
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held) {
            return false;
        }
        if (!e.key().equals(primaryKey)) {
            return false;
        }
        if (!e.modifiers().equals(requiredModifiers)) {
            return false;
        }
        held = true;
        return true;
    }

    @Override
    public boolean onKeyReleased(NormalizedKeyEvent e) {
        if (held && e.key().equals(primaryKey)) {
            held = false;
            return true;
        }
        return false;
    }
}
