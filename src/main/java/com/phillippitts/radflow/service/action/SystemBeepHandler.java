package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import com.phillippitts.radflow.service.queue.ActionHandler;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Component
class SystemBeepHandler implements ActionHandler {

    private final DictationStateReconciler reconciler;

    SystemBeepHandler(DictationStateReconciler reconciler) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.SYSTEM_BEEP);
    }

    @Override
    public void handle(ActionRequest request) {
        reconciler.systemBeep();
    }
}
