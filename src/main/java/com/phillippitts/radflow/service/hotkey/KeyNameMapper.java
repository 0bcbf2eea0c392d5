package com.phillippitts.radflow.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Canonicalizes key and modifier names, parses hotkey specs like {@code ctrl+shift+p}, and
 * validates them against an allow-list so bindings and the native hook agree on names.
 */
public final class KeyNameMapper {

    static final List<String> MODIFIER_ORDER = List.of("CONTROL", "ALT", "SHIFT", "META");

    private static final Set<String> ALLOWED_MODIFIERS = Set.copyOf(MODIFIER_ORDER);

    private static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE", "INSERT", "DELETE",
                "HOME", "END", "PAGE_UP", "PAGE_DOWN", "UP", "DOWN", "LEFT", "RIGHT"));
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a key name (case-insensitive, spaces to underscores, aliases). */
    public static String normalizeKey(String keyText) {
        if (keyText == null) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return switch (k) {
            case "ESC" -> "ESCAPE";
            case "RETURN" -> "ENTER";
            case "PGDN", "PAGEDOWN" -> "PAGE_DOWN";
            case "PGUP", "PAGEUP" -> "PAGE_UP";
            case "DEL" -> "DELETE";
            case "INS" -> "INSERT";
            default -> k;
        };
    }

    /** Normalize a single modifier alias to canonical form; left/right variants collapse. */
    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        String m = mod.trim().toUpperCase(Locale.ROOT).replace(' ', '_')
                .replace("LEFT_", "")
                .replace("RIGHT_", "");
        return switch (m) {
            case "CTRL", "CONTROL" -> "CONTROL";
            case "OPTION", "ALT" -> "ALT";
            case "CMD", "COMMAND", "WIN", "WINDOWS", "SUPER", "META" -> "META";
            default -> m;
        };
    }

    public static boolean isValidKey(String key) {
        return ALLOWED_KEYS.contains(normalizeKey(key));
    }

    public static boolean isValidModifier(String mod) {
        return ALLOWED_MODIFIERS.contains(normalizeModifier(mod));
    }

    /**
     * Parses {@code ctrl+shift+p}. Every part but one must be a modifier.
     *
     * @throws IllegalArgumentException if the spec is blank, has no key, more than one key,
     *                                  or an unknown key name
     */
    public static KeyCombination parseCombination(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Hotkey must not be blank");
        }
        Set<String> mods = new HashSet<>();
        String key = null;
        for (String part : spec.split("\\+")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            String mod = normalizeModifier(p);
            if (ALLOWED_MODIFIERS.contains(mod)) {
                mods.add(mod);
            } else if (key == null) {
                key = normalizeKey(p);
            } else {
                throw new IllegalArgumentException("Hotkey '" + spec + "' names more than one key");
            }
        }
        if (key == null) {
            throw new IllegalArgumentException("Hotkey '" + spec + "' has no key");
        }
        if (!ALLOWED_KEYS.contains(key)) {
            throw new IllegalArgumentException("Hotkey '" + spec + "' uses unknown key '" + key
                    + "'. Must be A-Z, 0-9, F1..F24 or a named key (ESCAPE, ENTER, PAGE_DOWN, ...)");
        }
        return new KeyCombination(mods, key);
    }

    /**
     * @return true if {@code combination} is exactly the reserved spec, e.g. {@code ALT+TAB}
     */
    public static boolean matchesReserved(KeyCombination combination, String reservedSpec) {
        if (reservedSpec == null || reservedSpec.isBlank()) {
            return false;
        }
        KeyCombination reserved;
        try {
            reserved = parseCombination(reservedSpec);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return reserved.key().equals(combination.key()) && reserved.modifiers().equals(combination.modifiers());
    }
}
