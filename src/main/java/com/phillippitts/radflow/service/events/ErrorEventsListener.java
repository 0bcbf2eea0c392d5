package com.phillippitts.radflow.service.events;

import com.phillippitts.radflow.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.radflow.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.radflow.service.queue.event.ActionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for error events. Throttled to one warning per key per minute.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Hotkey permission denied. On macOS grant Accessibility: "
                    + "System Settings > Privacy & Security > Accessibility (then restart app)");
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        String key = "hotkey-conflict-" + e.action() + '-' + e.hotkey();
        if (shouldLog(key)) {
            LOG.warn("Hotkey '{}' for {} conflicts with '{}'. Update bindings.actions.* properties.",
                    e.hotkey(), e.action(), e.conflictsWith());
        }
    }

    @EventListener
    void onActionFailed(ActionFailedEvent e) {
        String key = "action-" + e.kind() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Action {} from {} failed: {}", e.kind(), e.source(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
