package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import com.phillippitts.radflow.service.queue.ActionHandler;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Dictation toggle, plus the explicit start/stop used by the push-to-talk record button.
 */
@Component
class RecordingHandler implements ActionHandler {

    private final DictationStateReconciler reconciler;

    RecordingHandler(DictationStateReconciler reconciler) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.TOGGLE_RECORDING, ActionKind.START_RECORDING, ActionKind.STOP_RECORDING);
    }

    @Override
    public void handle(ActionRequest request) {
        switch (request.kind()) {
            case START_RECORDING -> reconciler.setRecording(true);
            case STOP_RECORDING -> reconciler.setRecording(false);
            default -> reconciler.setRecording(null);
        }
    }
}
