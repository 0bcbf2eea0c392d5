package com.phillippitts.radflow.service.hotkey;

import java.util.Set;

/**
 * A parsed hotkey: canonical modifier names plus one primary key.
 */
public record KeyCombination(Set<String> modifiers, String key) {

    public KeyCombination {
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public boolean hasModifiers() {
        return !modifiers.isEmpty();
    }

    /** Canonical spec with modifiers in a stable order, e.g. {@code CONTROL+SHIFT+P}. */
    public String spec() {
        StringBuilder sb = new StringBuilder();
        for (String m : KeyNameMapper.MODIFIER_ORDER) {
            if (modifiers.contains(m)) {
                sb.append(m).append('+');
            }
        }
        return sb.append(key).toString();
    }
}
