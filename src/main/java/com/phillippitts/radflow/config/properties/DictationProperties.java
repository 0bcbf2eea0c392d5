package com.phillippitts.radflow.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for dictation state tracking and audio feedback.
 */
@ConfigurationProperties(prefix = "dictation")
@Validated
public class DictationProperties {

    /** Enable the background recording-state sync. */
    private boolean syncEnabled = true;

    /** Background sync interval. Read by the scheduler annotation at startup. */
    @Positive
    private long syncIntervalMs = 250;

    /** Consecutive "not recording" reads required before the belief flips off. */
    @Positive(message = "Sticky-off threshold must be positive")
    private int stickyOffThreshold = 3;

    /** Window after a manual toggle during which background sync may not overwrite the belief. */
    @Min(0)
    private long manualLockoutMs = 500;

    /** Delay before the start cue, masking the reporting app's microphone warm-up. */
    @Min(0)
    private long startDelayMs = 1000;

    private boolean startCueEnabled = true;
    private boolean stopCueEnabled = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cueVolume = 0.04;

    @Positive
    private int startCueFrequencyHz = 1000;

    @Positive
    private int stopCueFrequencyHz = 500;

    @Positive
    private int cueDurationMs = 200;

    /** Stop dictation before processing a report. */
    private boolean autoStopOnProcess = true;

    /** Record button acts as push-to-talk: press starts, release stops. */
    private boolean deadManSwitch = false;

    public boolean isSyncEnabled() {
        return syncEnabled;
    }

    public void setSyncEnabled(boolean syncEnabled) {
        this.syncEnabled = syncEnabled;
    }

    public long getSyncIntervalMs() {
        return syncIntervalMs;
    }

    public void setSyncIntervalMs(long syncIntervalMs) {
        this.syncIntervalMs = syncIntervalMs;
    }

    public int getStickyOffThreshold() {
        return stickyOffThreshold;
    }

    public void setStickyOffThreshold(int stickyOffThreshold) {
        this.stickyOffThreshold = stickyOffThreshold;
    }

    public long getManualLockoutMs() {
        return manualLockoutMs;
    }

    public void setManualLockoutMs(long manualLockoutMs) {
        this.manualLockoutMs = manualLockoutMs;
    }

    public long getStartDelayMs() {
        return startDelayMs;
    }

    public void setStartDelayMs(long startDelayMs) {
        this.startDelayMs = startDelayMs;
    }

    public boolean isStartCueEnabled() {
        return startCueEnabled;
    }

    public void setStartCueEnabled(boolean startCueEnabled) {
        this.startCueEnabled = startCueEnabled;
    }

    public boolean isStopCueEnabled() {
        return stopCueEnabled;
    }

    public void setStopCueEnabled(boolean stopCueEnabled) {
        this.stopCueEnabled = stopCueEnabled;
    }

    public double getCueVolume() {
        return cueVolume;
    }

    public void setCueVolume(double cueVolume) {
        this.cueVolume = cueVolume;
    }

    public int getStartCueFrequencyHz() {
        return startCueFrequencyHz;
    }

    public void setStartCueFrequencyHz(int startCueFrequencyHz) {
        this.startCueFrequencyHz = startCueFrequencyHz;
    }

    public int getStopCueFrequencyHz() {
        return stopCueFrequencyHz;
    }

    public void setStopCueFrequencyHz(int stopCueFrequencyHz) {
        this.stopCueFrequencyHz = stopCueFrequencyHz;
    }

    public int getCueDurationMs() {
        return cueDurationMs;
    }

    public void setCueDurationMs(int cueDurationMs) {
        this.cueDurationMs = cueDurationMs;
    }

    public boolean isAutoStopOnProcess() {
        return autoStopOnProcess;
    }

    public void setAutoStopOnProcess(boolean autoStopOnProcess) {
        this.autoStopOnProcess = autoStopOnProcess;
    }

    public boolean isDeadManSwitch() {
        return deadManSwitch;
    }

    public void setDeadManSwitch(boolean deadManSwitch) {
        this.deadManSwitch = deadManSwitch;
    }
}
