package com.phillippitts.radflow.service.device;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.hotkey.event.HotkeyTriggeredEvent;
import com.phillippitts.radflow.service.queue.ActionQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns hotkey and device-button events into action requests.
 *
 * <p>With the dead-man switch on, the record button is push-to-talk: press starts dictation,
 * release stops it, and whatever action the button is bound to is ignored. Both edges are always
 * queued; the recording handler compares against the observed dictation state when they run.
 */
@Component
public class ActionTriggerRouter {

    private static final Logger LOG = LogManager.getLogger(ActionTriggerRouter.class);

    private final ActionQueue queue;
    private final BindingProperties bindings;
    private final DictationProperties dictationProps;

    public ActionTriggerRouter(ActionQueue queue,
                               BindingProperties bindings,
                               DictationProperties dictationProps) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.bindings = Objects.requireNonNull(bindings, "bindings must not be null");
        this.dictationProps = Objects.requireNonNull(dictationProps, "dictationProps must not be null");
    }

    @EventListener
    public void onHotkey(HotkeyTriggeredEvent event) {
        queue.enqueue(ActionRequest.of(event.action(), ActionSources.HOTKEY));
    }

    @EventListener
    public void onDeviceButton(DeviceButtonEvent event) {
        if (dictationProps.isDeadManSwitch() && ActionSources.RECORD_BUTTON.equalsIgnoreCase(event.button())) {
            return;
        }
        Optional<ActionKind> action = bindings.actionForButton(event.button());
        if (action.isEmpty()) {
            LOG.debug("Device button '{}' is not bound", event.button());
            return;
        }
        queue.enqueue(ActionRequest.of(action.get(), event.button()));
    }

    @EventListener
    public void onRecordButton(RecordButtonEvent event) {
        if (!dictationProps.isDeadManSwitch()) {
            if (event.pressed()) {
                onDeviceButton(new DeviceButtonEvent(ActionSources.RECORD_BUTTON, event.at()));
            }
            return;
        }
        ActionKind edge = event.pressed() ? ActionKind.START_RECORDING : ActionKind.STOP_RECORDING;
        queue.enqueue(ActionRequest.of(edge, ActionSources.RECORD_BUTTON));
    }
}
