package com.phillippitts.radflow.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for report handling around process/sign.
 */
@ConfigurationProperties(prefix = "report")
@Validated
public class ReportProperties {

    /** Search for and show the generated impression after processing. */
    private boolean showImpression = true;

    /** Capture a baseline so later additions can be highlighted. */
    private boolean trackChanges = true;

    /** Page down after processing, scaled by report length. */
    private boolean scrollOnProcess = true;

    @Positive
    private int scrollThreshold1 = 10;
    @Positive
    private int scrollThreshold2 = 30;
    @Positive
    private int scrollThreshold3 = 50;

    private boolean showLineCountToast = false;

    public boolean isShowImpression() {
        return showImpression;
    }

    public void setShowImpression(boolean showImpression) {
        this.showImpression = showImpression;
    }

    public boolean isTrackChanges() {
        return trackChanges;
    }

    public void setTrackChanges(boolean trackChanges) {
        this.trackChanges = trackChanges;
    }

    public boolean isScrollOnProcess() {
        return scrollOnProcess;
    }

    public void setScrollOnProcess(boolean scrollOnProcess) {
        this.scrollOnProcess = scrollOnProcess;
    }

    public int getScrollThreshold1() {
        return scrollThreshold1;
    }

    public void setScrollThreshold1(int scrollThreshold1) {
        this.scrollThreshold1 = scrollThreshold1;
    }

    public int getScrollThreshold2() {
        return scrollThreshold2;
    }

    public void setScrollThreshold2(int scrollThreshold2) {
        this.scrollThreshold2 = scrollThreshold2;
    }

    public int getScrollThreshold3() {
        return scrollThreshold3;
    }

    public void setScrollThreshold3(int scrollThreshold3) {
        this.scrollThreshold3 = scrollThreshold3;
    }

    public boolean isShowLineCountToast() {
        return showLineCountToast;
    }

    public void setShowLineCountToast(boolean showLineCountToast) {
        this.showLineCountToast = showLineCountToast;
    }

    /**
     * Number of page-down presses for a report with the given line count.
     */
    public int pageDownsFor(int lines) {
        if (lines >= scrollThreshold3) {
            return 3;
        }
        if (lines >= scrollThreshold2) {
            return 2;
        }
        if (lines >= scrollThreshold1) {
            return 1;
        }
        return 0;
    }
}
