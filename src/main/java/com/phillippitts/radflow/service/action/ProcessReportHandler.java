package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.config.properties.BindingProperties;
import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.config.properties.ReportProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.exception.ActionExecutionException;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.queue.event.ActionRequestedEvent;
import com.phillippitts.radflow.service.study.CaseContext;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.service.study.ImpressionSearch;
import com.phillippitts.radflow.service.study.ReportText;
import com.phillippitts.radflow.util.Pause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Processes the report: stops dictation if needed, sends "process", scrolls to the end of
 * the report and starts the impression search.
 *
 * <p>When the request comes from the device button the reporting app itself maps to process,
 * the app has already processed natively; the keystroke is then only sent when dictation was
 * running, since the app ignores the button while recording.
 */
@Component
class ProcessReportHandler implements ActionHandler {

    private static final Logger LOG = LogManager.getLogger(ProcessReportHandler.class);

    static final long MODIFIER_PAUSE_MS = 50;
    static final long STOP_SETTLE_MS = 200;
    static final long ACTIVATION_PAUSE_MS = 100;
    static final int SCROLL_TOAST_MS = 1500;

    private final DictationStateReconciler reconciler;
    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final CaseContextTracker cases;
    private final ImpressionSearch impressionSearch;
    private final DictationProperties dictationProps;
    private final ReportProperties reportProps;
    private final AlertProperties alertProps;
    private final BindingProperties bindings;
    private final ApplicationEventPublisher publisher;
    private final Pause pause;
    private final Clock clock;

    ProcessReportHandler(DictationStateReconciler reconciler,
                         ExternalCommander commander,
                         PresentationSurface presentation,
                         CaseContextTracker cases,
                         ImpressionSearch impressionSearch,
                         DictationProperties dictationProps,
                         ReportProperties reportProps,
                         AlertProperties alertProps,
                         BindingProperties bindings,
                         ApplicationEventPublisher publisher,
                         Pause pause,
                         Clock clock) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
        this.impressionSearch = Objects.requireNonNull(impressionSearch, "impressionSearch must not be null");
        this.dictationProps = Objects.requireNonNull(dictationProps, "dictationProps must not be null");
        this.reportProps = Objects.requireNonNull(reportProps, "reportProps must not be null");
        this.alertProps = Objects.requireNonNull(alertProps, "alertProps must not be null");
        this.bindings = Objects.requireNonNull(bindings, "bindings must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.PROCESS_REPORT);
    }

    @Override
    public void handle(ActionRequest request) {
        cases.markProcessPressed();
        commander.releaseModifiers();
        pause.pause(MODIFIER_PAUSE_MS);

        boolean wasRecording = reconciler.isRecording();
        if (dictationProps.isAutoStopOnProcess() && wasRecording) {
            reconciler.setRecording(false);
            pause.pause(STOP_SETTLE_MS);
        }

        boolean nativeButton = request.isFrom(ActionSources.SKIP_BACK)
                && bindings.isButtonBoundTo(ActionKind.PROCESS_REPORT, ActionSources.SKIP_BACK);
        if (!nativeButton || wasRecording) {
            commander.activateExternalApp();
            pause.pause(ACTIVATION_PAUSE_MS);
            if (!commander.emitKeystroke(ExternalCommand.PROCESS_REPORT)) {
                throw new ActionExecutionException(ActionKind.PROCESS_REPORT, "Process keystroke not sent");
            }
        } else {
            LOG.debug("Process already sent natively by {}", request.source());
        }

        scrollToEnd();

        if (reportProps.isShowImpression()) {
            impressionSearch.begin();
        }
        requestStrokeNoteIfDue();
    }

    private void scrollToEnd() {
        if (!reportProps.isScrollOnProcess()) {
            return;
        }
        String text = cases.lastReportText();
        if (text == null || text.isEmpty()) {
            return;
        }
        int lines = ReportText.lineCount(text);
        int presses = reportProps.pageDownsFor(lines);
        for (int i = 0; i < presses; i++) {
            commander.emitKeystroke(ExternalCommand.PAGE_DOWN);
        }
        if (reportProps.isShowLineCountToast()) {
            presentation.showToast("Smart Scroll: " + lines + " lines -> " + presses + " PgDn(s)", SCROLL_TOAST_MS);
        }
    }

    private void requestStrokeNoteIfDue() {
        if (!alertProps.isStrokeAutoCreateNote()) {
            return;
        }
        CaseContext live = cases.current();
        if (live.protocolFlag() && cases.markCriticalNoteRequested()) {
            publisher.publishEvent(new ActionRequestedEvent(
                    new ActionRequest(ActionKind.CREATE_CRITICAL_NOTE, ActionSources.INTERNAL, live.accession()),
                    clock.instant()));
        }
    }
}
