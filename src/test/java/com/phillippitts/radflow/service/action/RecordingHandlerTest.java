package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RecordingHandlerTest {

    private DictationStateReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = mock(DictationStateReconciler.class);
    }

    @Test
    void toggleLetsReconcilerDecide() {
        // Act
        new RecordingHandler(reconciler).handle(ActionRequest.of(ActionKind.TOGGLE_RECORDING, ActionSources.HOTKEY));

        // Assert
        verify(reconciler).setRecording(null);
    }

    @Test
    void pushToTalkStartsAndStops() {
        // Arrange
        RecordingHandler handler = new RecordingHandler(reconciler);

        // Act
        handler.handle(ActionRequest.of(ActionKind.START_RECORDING, ActionSources.RECORD_BUTTON));
        handler.handle(ActionRequest.of(ActionKind.STOP_RECORDING, ActionSources.RECORD_BUTTON));

        // Assert
        verify(reconciler).setRecording(true);
        verify(reconciler).setRecording(false);
    }

    @Test
    void beepDelegatesToReconciler() {
        // Act
        new SystemBeepHandler(reconciler).handle(ActionRequest.of(ActionKind.SYSTEM_BEEP, ActionSources.API));

        // Assert
        verify(reconciler).systemBeep();
    }
}
