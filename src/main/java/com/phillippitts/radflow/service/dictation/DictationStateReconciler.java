package com.phillippitts.radflow.service.dictation;

import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.ExternalOracle;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.util.Pause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the "is dictation recording" belief in sync with the reporting app.
 *
 * <p>The oracle is reliable for "on" but blips "off" while the app buffers audio, and it
 * always lags a keystroke by at least one read. Two mechanisms cooperate:
 * <ul>
 *   <li>{@link #syncOnce()} runs every {@code dictation.sync-interval-ms} and applies the
 *       instant-on / sticky-off policy of {@link DictationState}.</li>
 *   <li>{@link #setRecording(Boolean)} is the manual toggle. It predicts the new state
 *       locally and opens a lockout window so the next stale reads cannot undo it.</li>
 * </ul>
 *
 * <p>Manual toggles are only called from the action worker; the sync runs on the scheduler.
 */
@Service
public class DictationStateReconciler {

    private static final Logger LOG = LogManager.getLogger(DictationStateReconciler.class);

    static final long ACTIVATION_PAUSE_MS = 100;
    static final long MIN_BEEP_CHECK_MS = 1500;

    private final ExternalOracle oracle;
    private final ExternalCommander commander;
    private final FeedbackCues cues;
    private final PresentationSurface presentation;
    private final DictationProperties props;
    private final Clock clock;
    private final Pause pause;
    private final TaskScheduler scheduler;

    private final DictationState state = new DictationState();
    private final AtomicLong beepToken = new AtomicLong();

    public DictationStateReconciler(ExternalOracle oracle,
                                    ExternalCommander commander,
                                    FeedbackCues cues,
                                    PresentationSurface presentation,
                                    DictationProperties props,
                                    Clock clock,
                                    Pause pause,
                                    TaskScheduler scheduler) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.cues = Objects.requireNonNull(cues, "cues must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Scheduled(fixedDelayString = "${dictation.sync-interval-ms:250}")
    void scheduledSync() {
        if (props.isSyncEnabled()) {
            syncOnce();
        }
    }

    /**
     * One background sync step. An unknown or failed reading leaves all state untouched.
     */
    public void syncOnce() {
        Optional<Boolean> reading = probe();
        if (reading.isEmpty()) {
            return;
        }
        DictationState.SyncOutcome outcome = state.applyProbe(reading.get(), clock.instant(),
                props.getStickyOffThreshold(), Duration.ofMillis(props.getManualLockoutMs()));
        if (outcome.indicatorChanged()) {
            presentation.updateRecordingIndicator(outcome.indicator());
        }
        if (outcome.beliefChanged()) {
            LOG.debug("Recording belief synced to {}", outcome.believed());
        }
    }

    /**
     * Manual toggle.
     *
     * <p>With a desired state that the oracle already reports, no keystroke is sent but the
     * matching cue still plays. Otherwise the toggle keystroke is sent and the belief is set
     * to {@code desired}, or when {@code desired} is null to the negation of the oracle's
     * current reading (falling back to the belief when the oracle is unknown).
     *
     * @param desired target state, or null to flip
     * @return true if a toggle keystroke was sent
     */
    public boolean setRecording(Boolean desired) {
        state.recordManualToggle(clock.instant());
        boolean current = probe().orElseGet(state::believed);

        if (desired != null && current == desired) {
            state.setBelieved(desired);
            playCue(desired);
            LOG.debug("Recording already {}; no keystroke sent", desired ? "on" : "off");
            return false;
        }

        commander.activateExternalApp();
        pause.pause(ACTIVATION_PAUSE_MS);
        commander.emitKeystroke(ExternalCommand.TOGGLE_DICTATION);

        boolean predicted = desired != null ? desired : !current;
        state.setBelieved(predicted);
        presentation.updateRecordingIndicator(predicted);
        playCue(predicted);
        LOG.info("Recording toggled {}", predicted ? "on" : "off");
        return true;
    }

    /**
     * Flips the belief and plays the matching cue without sending any keystroke, for when the
     * user toggled dictation directly in the reporting app. A delayed reality check then
     * corrects a missed "on"; a newer beep cancels an older check.
     */
    public void systemBeep() {
        boolean now = state.toggle(clock.instant());
        presentation.updateRecordingIndicator(now);
        playCue(now);

        long token = beepToken.incrementAndGet();
        long delay = Math.max(MIN_BEEP_CHECK_MS, (long) (props.getStartDelayMs() * 2.5));
        scheduler.schedule(() -> realityCheck(token), clock.instant().plusMillis(delay));
    }

    // Package-private for tests
    void realityCheck(long token) {
        if (token != beepToken.get()) {
            return;
        }
        Optional<Boolean> reading = probe();
        if (reading.isPresent() && reading.get() && !state.believed()) {
            LOG.info("Reality check: dictation is on, correcting belief");
            state.setBelieved(true);
            presentation.updateRecordingIndicator(true);
        }
    }

    /** @return current belief */
    public boolean isRecording() {
        return state.believed();
    }

    int consecutiveFalseReads() {
        return state.consecutiveFalseReads();
    }

    Instant lastManualToggle() {
        return state.lastManualToggle();
    }

    private Optional<Boolean> probe() {
        try {
            return oracle.probeRecordingActive();
        } catch (RuntimeException e) {
            LOG.debug("Recording probe failed: {}", e.toString());
            return Optional.empty();
        }
    }

    private void playCue(boolean recording) {
        if (recording) {
            cues.recordingStarted();
        } else {
            cues.recordingStopped();
        }
    }
}
