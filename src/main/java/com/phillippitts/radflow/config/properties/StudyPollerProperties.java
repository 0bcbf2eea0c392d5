package com.phillippitts.radflow.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the study lifecycle poller.
 */
@ConfigurationProperties(prefix = "study")
@Validated
public class StudyPollerProperties {

    private boolean enabled = true;

    /** Normal interval between scrapes. */
    @Positive
    private long pollIntervalMs = 3000;

    /** Interval while an impression search is waiting for text. */
    @Positive
    private long fastIntervalMs = 1000;

    /** Interval once the impression has been found. */
    @Positive
    private long postImpressionIntervalMs = 3000;

    /** Minimum time after a process action before found impression text is trusted. */
    @Min(0)
    private long impressionSettleMs = 2000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getFastIntervalMs() {
        return fastIntervalMs;
    }

    public void setFastIntervalMs(long fastIntervalMs) {
        this.fastIntervalMs = fastIntervalMs;
    }

    public long getPostImpressionIntervalMs() {
        return postImpressionIntervalMs;
    }

    public void setPostImpressionIntervalMs(long postImpressionIntervalMs) {
        this.postImpressionIntervalMs = postImpressionIntervalMs;
    }

    public long getImpressionSettleMs() {
        return impressionSettleMs;
    }

    public void setImpressionSettleMs(long impressionSettleMs) {
        this.impressionSettleMs = impressionSettleMs;
    }

    public Duration impressionSettle() {
        return Duration.ofMillis(impressionSettleMs);
    }
}
