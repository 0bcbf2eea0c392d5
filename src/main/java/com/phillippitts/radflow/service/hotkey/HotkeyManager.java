package com.phillippitts.radflow.service.hotkey;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.radflow.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.radflow.service.hotkey.event.HotkeyTriggeredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Registers the global key hook and turns presses of bound hotkeys into
 * {@link HotkeyTriggeredEvent}s, one trigger per bound action.
 * Tests inject a fake GlobalKeyHook and emit NormalizedKeyEvent instances
 * directly to the registered listener.
 */
@Service
@ConditionalOnProperty(prefix = "bindings", name = "hotkeys-enabled", havingValue = "true", matchIfMissing = true)
public class HotkeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyManager.class);

    private final GlobalKeyHook hook;
    private final HotkeyTriggerFactory factory;
    private final BindingProperties props;
    private final ApplicationEventPublisher publisher;

    private final List<Registration> registrations = new ArrayList<>();
    private volatile boolean running;

    private record Registration(ActionKind action, String spec, HotkeyTrigger trigger) { }

    public HotkeyManager(GlobalKeyHook hook,
                         HotkeyTriggerFactory factory,
                         BindingProperties props,
                         ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.factory = factory;
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        registrations.clear();
        props.getActions().forEach((action, binding) -> {
            if (binding != null && binding.hasHotkey()) {
                registrations.add(new Registration(action, binding.getHotkey(), factory.from(binding.getHotkey())));
            }
        });
        if (registrations.isEmpty()) {
            LOG.info("No hotkeys bound; global key hook not registered");
            return;
        }
        detectConflicts();
        try {
            hook.addListener(dispatcher());
            hook.register();
            running = true;
            LOG.info("HotkeyManager started with {} hotkey(s)", registrations.size());
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
        } catch (RuntimeException e) {
            // Device buttons and the REST API still work without hotkeys
            LOG.error("Failed to start HotkeyManager", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering global key hook: {}", e.toString());
        }
        running = false;
        LOG.info("HotkeyManager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private Consumer<NormalizedKeyEvent> dispatcher() {
        return e -> {
            for (Registration r : registrations) {
                if (e.type() == NormalizedKeyEvent.Type.PRESSED) {
                    if (r.trigger().onKeyPressed(e)) {
                        LOG.debug("Hotkey {} -> {}", r.trigger().name(), r.action());
                        publisher.publishEvent(new HotkeyTriggeredEvent(r.action(), Instant.now()));
                    }
                } else {
                    r.trigger().onKeyReleased(e);
                }
            }
        };
    }

    private void detectConflicts() {
        Map<String, ActionKind> seen = new HashMap<>();
        for (Registration r : registrations) {
            KeyCombination combination = KeyNameMapper.parseCombination(r.spec());
            for (String reserved : props.getReserved()) {
                if (KeyNameMapper.matchesReserved(combination, reserved)) {
                    LOG.warn("Hotkey '{}' for {} conflicts with reserved '{}'", r.spec(), r.action(), reserved);
                    publisher.publishEvent(new HotkeyConflictEvent(r.action(), r.spec(), reserved, Instant.now()));
                    break;
                }
            }
            ActionKind other = seen.putIfAbsent(combination.spec(), r.action());
            if (other != null) {
                LOG.warn("Hotkey '{}' is bound to both {} and {}", r.spec(), other, r.action());
                publisher.publishEvent(new HotkeyConflictEvent(r.action(), r.spec(), other.displayName(), Instant.now()));
            }
        }
    }
}
