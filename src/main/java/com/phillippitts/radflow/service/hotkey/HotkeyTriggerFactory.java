package com.phillippitts.radflow.service.hotkey;

import com.phillippitts.radflow.service.hotkey.trigger.ModifierCombinationTrigger;
import com.phillippitts.radflow.service.hotkey.trigger.SingleKeyTrigger;
import org.springframework.stereotype.Component;

/**
 * Creates the trigger for a hotkey spec: a bare key or a modifier combination.
 */
@Component
public class HotkeyTriggerFactory {

    /**
     * @throws IllegalArgumentException if the spec does not parse
     */
    public HotkeyTrigger from(String spec) {
        KeyCombination combination = KeyNameMapper.parseCombination(spec);
        if (combination.hasModifiers()) {
            return new ModifierCombinationTrigger(combination.modifiers(), combination.key());
        }
        return new SingleKeyTrigger(combination.key());
    }
}
