package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.util.Pause;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Component
class CreateImpressionHandler implements ActionHandler {

    static final long ACTIVATION_PAUSE_MS = 100;
    static final int TOAST_MS = 1500;

    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final Pause pause;

    CreateImpressionHandler(ExternalCommander commander, PresentationSurface presentation, Pause pause) {
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.CREATE_IMPRESSION);
    }

    @Override
    public void handle(ActionRequest request) {
        // The reporting app maps this button to create-impression itself
        if (request.isFrom(ActionSources.SKIP_FORWARD)) {
            return;
        }
        commander.activateExternalApp();
        pause.pause(ACTIVATION_PAUSE_MS);
        if (commander.emitKeystroke(ExternalCommand.CREATE_IMPRESSION)) {
            presentation.showToast("Impression created", TOAST_MS);
        } else {
            presentation.showToast("Create impression failed", TOAST_MS);
        }
    }
}
