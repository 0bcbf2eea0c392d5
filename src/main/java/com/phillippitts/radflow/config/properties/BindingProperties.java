package com.phillippitts.radflow.config.properties;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionSources;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps actions to global hotkeys and dictation-microphone buttons.
 *
 * <p>Hotkeys are written like {@code ctrl+shift+p}. Device buttons use the names the
 * microphone bridge reports ({@code Skip Back}, {@code Checkmark}, ...).
 */
@ConfigurationProperties(prefix = "bindings")
@Validated
public class BindingProperties {

    /** Register the global key hook at startup. */
    private boolean hotkeysEnabled = true;

    private Map<ActionKind, Binding> actions = defaults();

    /**
     * Combinations that must not be bound: OS shortcuts and the reporting app's own
     * shortcuts, which the commander sends itself and would otherwise re-trigger an action.
     */
    private List<String> reserved = new ArrayList<>(List.of("ALT+R", "ALT+P", "ALT+F", "META+TAB", "ALT+TAB"));

    private static Map<ActionKind, Binding> defaults() {
        Map<ActionKind, Binding> map = new EnumMap<>(ActionKind.class);
        map.put(ActionKind.TOGGLE_RECORDING, new Binding("", ActionSources.RECORD_BUTTON));
        map.put(ActionKind.PROCESS_REPORT, new Binding("", ActionSources.SKIP_BACK));
        map.put(ActionKind.SIGN_REPORT, new Binding("", ActionSources.CHECKMARK));
        map.put(ActionKind.CREATE_IMPRESSION, new Binding("", ActionSources.SKIP_FORWARD));
        return map;
    }

    public boolean isHotkeysEnabled() {
        return hotkeysEnabled;
    }

    public void setHotkeysEnabled(boolean hotkeysEnabled) {
        this.hotkeysEnabled = hotkeysEnabled;
    }

    public Map<ActionKind, Binding> getActions() {
        return actions;
    }

    public void setActions(Map<ActionKind, Binding> actions) {
        this.actions = actions;
    }

    public List<String> getReserved() {
        return reserved;
    }

    public void setReserved(List<String> reserved) {
        this.reserved = reserved;
    }

    /**
     * @return the action bound to a device button, if any
     */
    public Optional<ActionKind> actionForButton(String button) {
        if (button == null) {
            return Optional.empty();
        }
        return actions.entrySet().stream()
                .filter(e -> button.equalsIgnoreCase(e.getValue().getDeviceButton()))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * @return true if {@code button} is the device button bound to {@code kind}
     */
    public boolean isButtonBoundTo(ActionKind kind, String button) {
        Binding binding = actions.get(kind);
        return binding != null && button != null && button.equalsIgnoreCase(binding.getDeviceButton());
    }

    /**
     * A hotkey and/or device button for one action. Blank means unbound.
     */
    public static class Binding {
        private String hotkey = "";
        private String deviceButton = "";

        public Binding() {
        }

        public Binding(String hotkey, String deviceButton) {
            this.hotkey = hotkey;
            this.deviceButton = deviceButton;
        }

        public String getHotkey() {
            return hotkey;
        }

        public void setHotkey(String hotkey) {
            this.hotkey = hotkey;
        }

        public String getDeviceButton() {
            return deviceButton;
        }

        public void setDeviceButton(String deviceButton) {
            this.deviceButton = deviceButton;
        }

        public boolean hasHotkey() {
            return hotkey != null && !hotkey.isBlank();
        }
    }
}
