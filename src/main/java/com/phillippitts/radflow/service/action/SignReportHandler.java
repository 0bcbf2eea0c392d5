package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.exception.ActionExecutionException;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.service.study.ImpressionSearch;
import com.phillippitts.radflow.util.Pause;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Marks the case signed and sends "sign" unless the device button already did.
 */
@Component
class SignReportHandler implements ActionHandler {

    static final long ACTIVATION_PAUSE_MS = 100;

    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final CaseContextTracker cases;
    private final ImpressionSearch impressionSearch;
    private final BindingProperties bindings;
    private final Pause pause;

    SignReportHandler(ExternalCommander commander,
                      PresentationSurface presentation,
                      CaseContextTracker cases,
                      ImpressionSearch impressionSearch,
                      BindingProperties bindings,
                      Pause pause) {
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
        this.impressionSearch = Objects.requireNonNull(impressionSearch, "impressionSearch must not be null");
        this.bindings = Objects.requireNonNull(bindings, "bindings must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.SIGN_REPORT);
    }

    @Override
    public void handle(ActionRequest request) {
        cases.markSigned();
        boolean nativeButton = request.isFrom(ActionSources.CHECKMARK)
                && bindings.isButtonBoundTo(ActionKind.SIGN_REPORT, ActionSources.CHECKMARK);
        try {
            if (!nativeButton) {
                commander.activateExternalApp();
                pause.pause(ACTIVATION_PAUSE_MS);
                if (!commander.emitKeystroke(ExternalCommand.SIGN_REPORT)) {
                    throw new ActionExecutionException(ActionKind.SIGN_REPORT, "Sign keystroke not sent");
                }
            }
        } finally {
            impressionSearch.end();
            presentation.hidePresentation();
        }
    }
}
