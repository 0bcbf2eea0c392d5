package com.phillippitts.radflow.service.dictation;

import com.phillippitts.radflow.config.properties.DictationProperties;
import com.phillippitts.radflow.service.external.AudioCuePlayer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Plays recording cues off the caller's thread. The start cue is delayed by
 * {@code dictation.start-delay-ms} so it lands when the reporting app is actually listening;
 * the stop cue plays immediately.
 */
@Component
class ScheduledFeedbackCues implements FeedbackCues {

    private static final Logger LOG = LogManager.getLogger(ScheduledFeedbackCues.class);

    private final AudioCuePlayer player;
    private final TaskScheduler scheduler;
    private final Executor cueExecutor;
    private final DictationProperties props;
    private final Clock clock;

    ScheduledFeedbackCues(AudioCuePlayer player,
                          TaskScheduler scheduler,
                          @Qualifier("cueExecutor") Executor cueExecutor,
                          DictationProperties props,
                          Clock clock) {
        this.player = player;
        this.scheduler = scheduler;
        this.cueExecutor = cueExecutor;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public void recordingStarted() {
        if (!props.isStartCueEnabled()) {
            return;
        }
        int hz = props.getStartCueFrequencyHz();
        scheduler.schedule(() -> cueExecutor.execute(() -> play(hz)),
                clock.instant().plusMillis(props.getStartDelayMs()));
    }

    @Override
    public void recordingStopped() {
        if (!props.isStopCueEnabled()) {
            return;
        }
        int hz = props.getStopCueFrequencyHz();
        cueExecutor.execute(() -> play(hz));
    }

    private void play(int hz) {
        LOG.debug("Cue {}Hz", hz);
        player.play(hz, props.getCueDurationMs(), props.getCueVolume());
    }
}
