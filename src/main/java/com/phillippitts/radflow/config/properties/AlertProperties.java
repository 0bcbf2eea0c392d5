package com.phillippitts.radflow.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for alert evaluation and presentation.
 */
@ConfigurationProperties(prefix = "alerts")
@Validated
public class AlertProperties {

    public enum Mode {
        /** A single alert surface, shown only while some condition is active. */
        ALERTS_ONLY,
        /** All indicators rendered every cycle, no arbitration. */
        ALWAYS_SHOW
    }

    @NotNull
    private Mode mode = Mode.ALERTS_ONLY;

    private boolean templateCheckEnabled = true;
    private boolean genderCheckEnabled = true;
    private boolean strokeDetectionEnabled = true;

    /** Also scan the clinical history for stroke keywords, not just the worklist classification. */
    private boolean strokeKeywordScan = false;

    /** Create a critical note automatically for stroke cases once the report is processed. */
    private boolean strokeAutoCreateNote = false;

    private List<String> strokeKeywords = new ArrayList<>(List.of(
            "stroke", "CVA", "TIA", "hemiparesis", "hemiplegia", "aphasia", "dysarthria",
            "facial droop", "weakness", "numbness", "code stroke", "NIH stroke scale", "NIHSS"));

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public boolean isTemplateCheckEnabled() {
        return templateCheckEnabled;
    }

    public void setTemplateCheckEnabled(boolean templateCheckEnabled) {
        this.templateCheckEnabled = templateCheckEnabled;
    }

    public boolean isGenderCheckEnabled() {
        return genderCheckEnabled;
    }

    public void setGenderCheckEnabled(boolean genderCheckEnabled) {
        this.genderCheckEnabled = genderCheckEnabled;
    }

    public boolean isStrokeDetectionEnabled() {
        return strokeDetectionEnabled;
    }

    public void setStrokeDetectionEnabled(boolean strokeDetectionEnabled) {
        this.strokeDetectionEnabled = strokeDetectionEnabled;
    }

    public boolean isStrokeKeywordScan() {
        return strokeKeywordScan;
    }

    public void setStrokeKeywordScan(boolean strokeKeywordScan) {
        this.strokeKeywordScan = strokeKeywordScan;
    }

    public boolean isStrokeAutoCreateNote() {
        return strokeAutoCreateNote;
    }

    public void setStrokeAutoCreateNote(boolean strokeAutoCreateNote) {
        this.strokeAutoCreateNote = strokeAutoCreateNote;
    }

    public List<String> getStrokeKeywords() {
        return strokeKeywords;
    }

    public void setStrokeKeywords(List<String> strokeKeywords) {
        this.strokeKeywords = strokeKeywords;
    }
}
