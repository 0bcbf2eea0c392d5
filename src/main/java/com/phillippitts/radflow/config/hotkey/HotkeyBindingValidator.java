package com.phillippitts.radflow.config.hotkey;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.service.hotkey.KeyNameMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Validates action bindings at startup to fail fast with actionable messages.
 */
@Component
class HotkeyBindingValidator {

    private final BindingProperties props;

    HotkeyBindingValidator(BindingProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        for (Map.Entry<ActionKind, BindingProperties.Binding> e : props.getActions().entrySet()) {
            ActionKind action = e.getKey();
            BindingProperties.Binding binding = e.getValue();
            if (binding == null) {
                continue;
            }
            boolean bound = binding.hasHotkey()
                    || (binding.getDeviceButton() != null && !binding.getDeviceButton().isBlank());
            if (bound && !action.isBindable()) {
                throw new IllegalArgumentException("bindings.actions." + action
                        + ": action is internal and cannot be bound");
            }
            if (binding.hasHotkey()) {
                try {
                    KeyNameMapper.parseCombination(binding.getHotkey());
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Invalid bindings.actions." + action + ".hotkey: "
                            + ex.getMessage(), ex);
                }
            }
        }
        // Reserved entries that do not parse are ignored rather than rejected
    }
}
