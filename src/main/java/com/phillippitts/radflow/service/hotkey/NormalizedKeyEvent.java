package com.phillippitts.radflow.service.hotkey;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyboard event in canonical key and modifier names, independent of the native hook library.
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = KeyNameMapper.normalizeKey(key);
        modifiers = modifiers == null ? Set.of()
                : modifiers.stream().map(KeyNameMapper::normalizeModifier).collect(Collectors.toUnmodifiableSet());
    }
}
