package com.phillippitts.radflow.service.hotkey;

import com.phillippitts.radflow.service.hotkey.trigger.ModifierCombinationTrigger;
import com.phillippitts.radflow.service.hotkey.trigger.SingleKeyTrigger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HotkeyTriggerFactoryTest {

    private final HotkeyTriggerFactory factory = new HotkeyTriggerFactory();

    @Test
    void bareKeyBuildsSingleKeyTrigger() {
        assertThat(factory.from("f9")).isInstanceOf(SingleKeyTrigger.class);
    }

    @Test
    void combinationBuildsModifierTrigger() {
        HotkeyTrigger trigger = factory.from("ctrl+shift+p");
        assertThat(trigger).isInstanceOf(ModifierCombinationTrigger.class);
        assertThat(trigger.name()).startsWith("combo:").endsWith("+P");
    }

    @Test
    void invalidSpecIsRejected() {
        assertThatThrownBy(() -> factory.from("ctrl+")).isInstanceOf(IllegalArgumentException.class);
    }
}
