package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.ReportProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.study.CaseContext;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Toggles the report presentation. Additions are highlighted against the baseline only once
 * the report has been processed.
 */
@Component
class ShowReportHandler implements ActionHandler {

    static final int TOAST_MS = 1500;

    private final PresentationSurface presentation;
    private final CaseContextTracker cases;
    private final ReportProperties reportProps;

    ShowReportHandler(PresentationSurface presentation, CaseContextTracker cases, ReportProperties reportProps) {
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
        this.reportProps = Objects.requireNonNull(reportProps, "reportProps must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.SHOW_REPORT);
    }

    @Override
    public void handle(ActionRequest request) {
        if (presentation.isReportVisible()) {
            presentation.hideReport();
            return;
        }
        String text = cases.lastReportText();
        if (text == null || text.isBlank()) {
            presentation.showToast("No report to show", TOAST_MS);
            return;
        }
        CaseContext live = cases.current();
        String baseline = reportProps.isTrackChanges() && live.processPressed() ? live.baselineReport() : null;
        presentation.showReport(text, baseline);
    }
}
