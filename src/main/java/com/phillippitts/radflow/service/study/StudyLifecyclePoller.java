package com.phillippitts.radflow.service.study;

import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.config.properties.ReportProperties;
import com.phillippitts.radflow.config.properties.StudyPollerProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.domain.AlertState;
import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.service.alert.AlertArbitrator;
import com.phillippitts.radflow.service.alert.StrokeClassifier;
import com.phillippitts.radflow.service.external.ExternalOracle;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.insert.MacroComposer;
import com.phillippitts.radflow.service.metrics.OrchestrationMetrics;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.queue.ExternalAccessGate;
import com.phillippitts.radflow.service.queue.event.ActionRequestedEvent;
import com.phillippitts.radflow.service.study.event.CaseTerminatedEvent;
import com.phillippitts.radflow.service.study.event.ImpressionSearchChangedEvent;
import com.phillippitts.radflow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic scrape of the reporting app that tracks the open case.
 *
 * <p>Each cycle:
 * <ol>
 *   <li>Skips entirely while the action worker holds the {@link ExternalAccessGate}.</li>
 *   <li>Probes the case snapshot and the discard confirmation. A failed or unknown probe
 *       abandons the cycle without touching any state.</li>
 *   <li>Detects a case change and publishes exactly one {@link CaseTerminatedEvent} for the
 *       case that was left, then resets per-case state.</li>
 *   <li>Captures the change-tracking baseline once the report has stabilized.</li>
 *   <li>Inserts pending macros and requests the automatic critical note when due.</li>
 *   <li>Evaluates and presents alerts.</li>
 *   <li>Advances the impression search and the impression presentation.</li>
 * </ol>
 *
 * <p>The schedule is re-armed whenever the impression search changes mode: fast while
 * searching, the post-impression interval once found, the normal interval otherwise.
 */
@Service
public class StudyLifecyclePoller implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(StudyLifecyclePoller.class);
    static final int NEW_STUDY_TOAST_MS = 2000;
    static final int PROTOCOL_TOAST_MS = 4000;

    private final ExternalOracle oracle;
    private final ExternalAccessGate gate;
    private final CaseContextTracker cases;
    private final CriticalNoteTracker notes;
    private final AlertArbitrator alerts;
    private final StrokeClassifier strokeClassifier;
    private final ImpressionSearch impressionSearch;
    private final MacroComposer macroComposer;
    private final PresentationSurface presentation;
    private final StudyPollerProperties props;
    private final ReportProperties reportProps;
    private final AlertProperties alertProps;
    private final OrchestrationMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> schedule;
    private volatile boolean running;

    // Poller thread only
    private boolean impressionAutoShown;
    private String lastImpressionShown;

    public StudyLifecyclePoller(ExternalOracle oracle,
                                ExternalAccessGate gate,
                                CaseContextTracker cases,
                                CriticalNoteTracker notes,
                                AlertArbitrator alerts,
                                StrokeClassifier strokeClassifier,
                                ImpressionSearch impressionSearch,
                                MacroComposer macroComposer,
                                PresentationSurface presentation,
                                StudyPollerProperties props,
                                ReportProperties reportProps,
                                AlertProperties alertProps,
                                OrchestrationMetrics metrics,
                                ApplicationEventPublisher publisher,
                                TaskScheduler scheduler,
                                Clock clock) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
        this.notes = Objects.requireNonNull(notes, "notes must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.strokeClassifier = Objects.requireNonNull(strokeClassifier, "strokeClassifier must not be null");
        this.impressionSearch = Objects.requireNonNull(impressionSearch, "impressionSearch must not be null");
        this.macroComposer = Objects.requireNonNull(macroComposer, "macroComposer must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.reportProps = Objects.requireNonNull(reportProps, "reportProps must not be null");
        this.alertProps = Objects.requireNonNull(alertProps, "alertProps must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Study poller disabled (study.enabled=false)");
            return;
        }
        running = true;
        rearm(intervalFor(impressionSearch.mode()));
        LOG.info("Study poller started at {}ms", props.getPollIntervalMs());
    }

    /**
     * Stops re-arming. A cycle in progress finishes.
     */
    @Override
    public void stop() {
        running = false;
        synchronized (scheduleLock) {
            if (schedule != null) {
                schedule.cancel(false);
                schedule = null;
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @EventListener
    public void onImpressionSearchChanged(ImpressionSearchChangedEvent event) {
        if (running) {
            rearm(intervalFor(event.mode()));
        }
    }

    Duration intervalFor(ImpressionMode mode) {
        return switch (mode) {
            case FAST -> Duration.ofMillis(props.getFastIntervalMs());
            case FOUND -> Duration.ofMillis(props.getPostImpressionIntervalMs());
            case IDLE -> Duration.ofMillis(props.getPollIntervalMs());
        };
    }

    private void rearm(Duration interval) {
        synchronized (scheduleLock) {
            if (schedule != null) {
                schedule.cancel(false);
            }
            schedule = scheduler.scheduleWithFixedDelay(this::pollOnce, interval);
        }
        LOG.debug("Study poller re-armed at {}ms", interval.toMillis());
    }

    /**
     * Runs one cycle unless another cycle or an action is in progress.
     */
    public void pollOnce() {
        if (!cycleLock.tryLock()) {
            return;
        }
        try {
            if (!gate.tryEnter()) {
                metrics.incrementPollSkipped("busy");
                LOG.trace("Action in progress; poll cycle skipped");
                return;
            }
            try {
                cycle();
            } finally {
                gate.exit();
            }
        } catch (RuntimeException e) {
            LOG.warn("Poll cycle failed: {}", e.toString(), e);
        } finally {
            cycleLock.unlock();
        }
    }

    private void cycle() {
        CaseSnapshot snapshot;
        boolean discardVisible;
        try {
            Optional<CaseSnapshot> probed = oracle.probeCaseSnapshot();
            if (probed.isEmpty()) {
                metrics.incrementPollSkipped("unknown");
                return;
            }
            snapshot = probed.get();
            discardVisible = oracle.probeDiscardDialogVisible().orElse(false);
        } catch (RuntimeException e) {
            metrics.incrementPollSkipped("probe-failed");
            LOG.debug("Case probe failed; cycle abandoned: {}", e.toString());
            return;
        }

        if (discardVisible) {
            cases.markDiscardObserved();
        }

        AccessionTransition transition = cases.observe(snapshot.accession());
        if (transition.changed()) {
            onCaseChanged(transition, snapshot);
        }
        cases.updateDescription(snapshot.description());

        CaseContext live = cases.current();
        if (!live.isOpen()) {
            alerts.reset();
            cases.recordReportText(snapshot.reportText());
            return;
        }

        String text = snapshot.reportTextOrEmpty();
        String impression = ReportText.extractImpression(text);

        captureBaselineIfStable(live, text, impression);
        insertPendingMacros(text);
        requestAutoNoteIfDue(live);

        AlertState state = alerts.evaluate(snapshot, live.protocolFlag());
        alerts.present(state);

        advanceImpression(snapshot, impression);
        refreshReportIfShown(live, text);
    }

    private void onCaseChanged(AccessionTransition transition, CaseSnapshot snapshot) {
        if (transition.closedPrevious()) {
            String prev = transition.previousAccession();
            boolean hadNote = notes.hasCriticalNoteFor(prev);
            publisher.publishEvent(new CaseTerminatedEvent(prev, transition.outcome(), hadNote, clock.instant()));
        }
        notes.reset();
        alerts.reset();
        impressionSearch.end();
        presentation.hidePresentation();
        impressionAutoShown = false;
        lastImpressionShown = null;

        if (!transition.openedNew()) {
            return;
        }
        String accession = transition.newAccession();
        String description = snapshot.description();
        presentation.showToast(description == null || description.isBlank()
                ? "New Study" : "New Study: " + description, NEW_STUDY_TOAST_MS);

        boolean flagged = classify(accession, snapshot.reportText());
        cases.setProtocolFlag(flagged);
        if (flagged) {
            LOG.info("Case {} flagged as stroke protocol", accession);
            presentation.showToast("Stroke Protocol", PROTOCOL_TOAST_MS);
        }
        macroComposer.compose(description).ifPresent(cases::setPendingMacros);
    }

    private boolean classify(String accession, String reportText) {
        CaseClassification classification = null;
        try {
            classification = oracle.probeCaseClassification(accession).orElse(null);
        } catch (RuntimeException e) {
            LOG.debug("Classification probe failed for {}: {}", accession, e.toString());
        }
        return strokeClassifier.isProtocolCase(classification, reportText);
    }

    private void captureBaselineIfStable(CaseContext live, String text, String impression) {
        if (!reportProps.isTrackChanges() || live.baselineReport() != null || live.processPressed()) {
            return;
        }
        if (text.isEmpty() || impression.isEmpty()) {
            return;
        }
        if (cases.captureBaseline(text)) {
            LOG.debug("Baseline captured for {}: {}", live.accession(), LogSanitizer.preview(text));
        }
    }

    private void insertPendingMacros(String text) {
        if (!ReportText.hasClinicalHistory(text)) {
            return;
        }
        cases.takePendingMacros().ifPresent(macros -> publisher.publishEvent(new ActionRequestedEvent(
                new ActionRequest(ActionKind.INSERT_MACROS, ActionSources.INTERNAL, macros), clock.instant())));
    }

    private void requestAutoNoteIfDue(CaseContext live) {
        if (!alertProps.isStrokeAutoCreateNote() || !live.protocolFlag() || !live.processPressed()) {
            return;
        }
        if (cases.markCriticalNoteRequested()) {
            LOG.info("Requesting critical note for stroke case {}", live.accession());
            publisher.publishEvent(new ActionRequestedEvent(
                    new ActionRequest(ActionKind.CREATE_CRITICAL_NOTE, ActionSources.INTERNAL, live.accession()),
                    clock.instant()));
        }
    }

    private void advanceImpression(CaseSnapshot snapshot, String impression) {
        switch (impressionSearch.mode()) {
            case FAST -> {
                if (impressionSearch.tryMarkFound(impression, props.impressionSettle())) {
                    show(impression);
                    impressionAutoShown = false;
                }
            }
            case FOUND -> {
                if (!impression.isEmpty() && !impression.equals(lastImpressionShown)) {
                    show(impression);
                }
            }
            case IDLE -> {
                if (snapshot.isDrafted() && !impression.isEmpty()) {
                    if (!presentation.isPresentationVisible() || !impression.equals(lastImpressionShown)) {
                        show(impression);
                    }
                    impressionAutoShown = true;
                } else if (!snapshot.isDrafted() && impressionAutoShown) {
                    presentation.hidePresentation();
                    impressionAutoShown = false;
                    lastImpressionShown = null;
                }
            }
        }
    }

    private void show(String impression) {
        presentation.updatePresentation(impression);
        lastImpressionShown = impression;
    }

    private void refreshReportIfShown(CaseContext live, String text) {
        String previous = cases.lastReportText();
        cases.recordReportText(text);
        if (presentation.isReportVisible() && !text.equals(previous)) {
            String baseline = reportProps.isTrackChanges() && live.processPressed() ? live.baselineReport() : null;
            presentation.showReport(text, baseline);
        }
    }
}
