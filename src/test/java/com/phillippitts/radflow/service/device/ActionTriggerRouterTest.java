package com.phillippitts.radflow.service.device;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.hotkey.event.HotkeyTriggeredEvent;
import com.phillippitts.radflow.service.queue.ActionQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ActionTriggerRouterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private ActionQueue queue;
    private DictationProperties dictationProps;
    private ActionTriggerRouter router;

    @BeforeEach
    void setUp() {
        queue = mock(ActionQueue.class);
        dictationProps = new DictationProperties();
        router = new ActionTriggerRouter(queue, new BindingProperties(), dictationProps);
    }

    @Test
    void hotkeyEnqueuesItsAction() {
        // Act
        router.onHotkey(new HotkeyTriggeredEvent(ActionKind.SHOW_REPORT, NOW));

        // Assert
        verify(queue).enqueue(ActionRequest.of(ActionKind.SHOW_REPORT, ActionSources.HOTKEY));
    }

    @Test
    void boundButtonEnqueuesWithButtonAsSource() {
        // Act
        router.onDeviceButton(new DeviceButtonEvent("skip back", NOW));

        // Assert
        verify(queue).enqueue(ActionRequest.of(ActionKind.PROCESS_REPORT, "skip back"));
    }

    @Test
    void unboundButtonIsIgnored() {
        // Act
        router.onDeviceButton(new DeviceButtonEvent("Rewind", NOW));

        // Assert
        verify(queue, never()).enqueue(any());
    }

    @Test
    void recordButtonTogglesOnPressOnly() {
        // Act
        router.onRecordButton(new RecordButtonEvent(true, NOW));
        router.onRecordButton(new RecordButtonEvent(false, NOW));

        // Assert
        verify(queue).enqueue(ActionRequest.of(ActionKind.TOGGLE_RECORDING, ActionSources.RECORD_BUTTON));
    }

    @Test
    void pushToTalkStartsOnPressAndStopsOnRelease() {
        // Arrange
        dictationProps.setDeadManSwitch(true);

        // Act
        router.onRecordButton(new RecordButtonEvent(true, NOW));
        router.onRecordButton(new RecordButtonEvent(false, NOW));

        // Assert
        InOrder order = inOrder(queue);
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.START_RECORDING, ActionSources.RECORD_BUTTON));
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.STOP_RECORDING, ActionSources.RECORD_BUTTON));
    }

    @Test
    void quickReleaseStillQueuesStopBehindPendingStart() {
        // Arrange
        dictationProps.setDeadManSwitch(true);

        // Act
        router.onRecordButton(new RecordButtonEvent(true, NOW));
        router.onRecordButton(new RecordButtonEvent(false, NOW.plusMillis(30)));
        router.onRecordButton(new RecordButtonEvent(true, NOW.plusMillis(60)));
        router.onRecordButton(new RecordButtonEvent(false, NOW.plusMillis(90)));

        // Assert
        InOrder order = inOrder(queue);
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.START_RECORDING, ActionSources.RECORD_BUTTON));
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.STOP_RECORDING, ActionSources.RECORD_BUTTON));
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.START_RECORDING, ActionSources.RECORD_BUTTON));
        order.verify(queue).enqueue(ActionRequest.of(ActionKind.STOP_RECORDING, ActionSources.RECORD_BUTTON));
    }

    @Test
    void pushToTalkIgnoresBoundRecordButtonAction() {
        // Arrange
        dictationProps.setDeadManSwitch(true);

        // Act
        router.onDeviceButton(new DeviceButtonEvent(ActionSources.RECORD_BUTTON, NOW));

        // Assert
        verify(queue, never()).enqueue(any());
    }
}
