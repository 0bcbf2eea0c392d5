package com.phillippitts.radflow.service.hotkey;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.radflow.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.radflow.service.hotkey.event.HotkeyTriggeredEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class HotkeyManagerTest {

    private static BindingProperties bind(ActionKind action, String hotkey, BindingProperties props) {
        props.getActions().put(action, new BindingProperties.Binding(hotkey, ""));
        return props;
    }

    private static NormalizedKeyEvent press(String key, String... mods) {
        return new NormalizedKeyEvent(NormalizedKeyEvent.Type.PRESSED, key, Set.of(mods), System.currentTimeMillis());
    }

    private static NormalizedKeyEvent release(String key, String... mods) {
        return new NormalizedKeyEvent(NormalizedKeyEvent.Type.RELEASED, key, Set.of(mods), System.currentTimeMillis());
    }

    @Test
    void publishesTriggeredEventForBoundHotkey() {
        // Arrange
        BindingProperties props = bind(ActionKind.SHOW_REPORT, "ctrl+shift+r", new BindingProperties());
        List<Object> events = new ArrayList<>();
        ApplicationEventPublisher publisher = events::add;
        FakeHook hook = new FakeHook();
        HotkeyManager mgr = new HotkeyManager(hook, new HotkeyTriggerFactory(), props, publisher);

        // Act
        mgr.start();
        hook.emit(press("R", "CONTROL", "SHIFT"));
        hook.emit(press("R", "CONTROL", "SHIFT"));
        hook.emit(release("R", "CONTROL", "SHIFT"));
        mgr.stop();

        // Assert
        assertThat(events).filteredOn(HotkeyTriggeredEvent.class::isInstance)
                .extracting(e -> ((HotkeyTriggeredEvent) e).action())
                .containsExactly(ActionKind.SHOW_REPORT);
        assertThat(hook.registered()).isFalse();
    }

    @Test
    void noHotkeysMeansNoHook() {
        // Arrange
        FakeHook hook = new FakeHook();
        HotkeyManager mgr = new HotkeyManager(hook, new HotkeyTriggerFactory(), new BindingProperties(), e -> { });

        // Act
        mgr.start();

        // Assert
        assertThat(hook.registered()).isFalse();
        assertThat(mgr.isRunning()).isFalse();
    }

    @Test
    void reportsReservedAndDuplicateBindings() {
        // Arrange
        BindingProperties props = new BindingProperties();
        bind(ActionKind.SIGN_REPORT, "alt+tab", props);
        bind(ActionKind.SHOW_REPORT, "f9", props);
        bind(ActionKind.SHOW_PICK_LISTS, "F9", props);
        List<Object> events = new ArrayList<>();
        HotkeyManager mgr = new HotkeyManager(new FakeHook(), new HotkeyTriggerFactory(), props, events::add);

        // Act
        mgr.start();

        // Assert
        List<HotkeyConflictEvent> conflicts = events.stream()
                .filter(HotkeyConflictEvent.class::isInstance)
                .map(HotkeyConflictEvent.class::cast)
                .toList();
        assertThat(conflicts).hasSize(2);
        assertThat(conflicts).anySatisfy(c -> {
            assertThat(c.action()).isEqualTo(ActionKind.SIGN_REPORT);
            assertThat(c.conflictsWith()).isEqualTo("ALT+TAB");
        });
        assertThat(conflicts).anySatisfy(c -> assertThat(c.hotkey()).isEqualToIgnoringCase("f9"));
    }

    @Test
    void permissionDeniedIsPublished() {
        // Arrange
        BindingProperties props = bind(ActionKind.SHOW_REPORT, "f9", new BindingProperties());
        List<Object> events = new ArrayList<>();
        FakeHook hook = new FakeHook();
        hook.denyPermission = true;
        HotkeyManager mgr = new HotkeyManager(hook, new HotkeyTriggerFactory(), props, events::add);

        // Act
        mgr.start();

        // Assert
        assertThat(events).hasAtLeastOneElementOfType(HotkeyPermissionDeniedEvent.class);
        assertThat(mgr.isRunning()).isFalse();
    }

    static class FakeHook implements GlobalKeyHook {
        private final AtomicBoolean reg = new AtomicBoolean();
        private volatile Consumer<NormalizedKeyEvent> listener;
        volatile boolean denyPermission;
        @Override public void register() {
            if (denyPermission) {
                throw new SecurityException("accessibility not granted");
            }
            reg.set(true);
        }
        @Override public void unregister() { reg.set(false); }
        @Override public void addListener(Consumer<NormalizedKeyEvent> listener) { this.listener = listener; }
        boolean registered() { return reg.get(); }
        void emit(NormalizedKeyEvent e) { Consumer<NormalizedKeyEvent> l = listener; if (l != null) l.accept(e); }
    }
}
