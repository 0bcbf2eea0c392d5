package com.phillippitts.radflow.service.external.impl;

import java.awt.event.KeyEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A parsed keystroke such as {@code alt+r} or {@code ctrl+shift+page_down}, expressed as AWT key codes.
 */
record Keystroke(List<Integer> modifierCodes, int keyCode) {

    private static final Map<String, Integer> MODIFIERS = Map.of(
            "CTRL", KeyEvent.VK_CONTROL,
            "CONTROL", KeyEvent.VK_CONTROL,
            "ALT", KeyEvent.VK_ALT,
            "OPTION", KeyEvent.VK_ALT,
            "SHIFT", KeyEvent.VK_SHIFT,
            "META", KeyEvent.VK_META,
            "CMD", KeyEvent.VK_META,
            "WIN", KeyEvent.VK_WINDOWS);

    private static final Map<String, Integer> NAMED_KEYS = Map.ofEntries(
            Map.entry("PAGE_DOWN", KeyEvent.VK_PAGE_DOWN),
            Map.entry("PAGE_UP", KeyEvent.VK_PAGE_UP),
            Map.entry("HOME", KeyEvent.VK_HOME),
            Map.entry("END", KeyEvent.VK_END),
            Map.entry("ENTER", KeyEvent.VK_ENTER),
            Map.entry("TAB", KeyEvent.VK_TAB),
            Map.entry("SPACE", KeyEvent.VK_SPACE),
            Map.entry("ESCAPE", KeyEvent.VK_ESCAPE),
            Map.entry("DELETE", KeyEvent.VK_DELETE),
            Map.entry("BACKSPACE", KeyEvent.VK_BACK_SPACE));

    Keystroke {
        modifierCodes = List.copyOf(modifierCodes);
    }

    /**
     * Parses a {@code +}-separated keystroke. The last non-modifier part is the key.
     *
     * @throws IllegalArgumentException if the spec is blank, has no key, or names an unknown key
     */
    static Keystroke parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Keystroke must not be blank");
        }
        List<Integer> mods = new ArrayList<>();
        Integer key = null;
        for (String part : spec.split("\\+")) {
            String p = part.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
            if (p.isEmpty()) {
                continue;
            }
            Integer mod = MODIFIERS.get(p);
            if (mod != null) {
                mods.add(mod);
            } else {
                key = keyCode(p);
            }
        }
        if (key == null) {
            throw new IllegalArgumentException("Keystroke has no key: '" + spec + "'");
        }
        return new Keystroke(mods, key);
    }

    private static int keyCode(String name) {
        Integer named = NAMED_KEYS.get(name);
        if (named != null) {
            return named;
        }
        if (name.length() == 1) {
            char c = name.charAt(0);
            if (c >= 'A' && c <= 'Z') {
                return KeyEvent.VK_A + (c - 'A');
            }
            if (c >= '0' && c <= '9') {
                return KeyEvent.VK_0 + (c - '0');
            }
        }
        if (name.matches("F([1-9]|1[0-2])")) {
            return KeyEvent.VK_F1 + Integer.parseInt(name.substring(1)) - 1;
        }
        throw new IllegalArgumentException("Unknown key: '" + name + "'");
    }
}
