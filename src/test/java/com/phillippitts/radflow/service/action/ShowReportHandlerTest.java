package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.ReportProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface.ReportShown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShowReportHandlerTest {

    private RecordingPresentationSurface presentation;
    private CaseContextTracker cases;
    private ReportProperties props;
    private ShowReportHandler handler;

    @BeforeEach
    void setUp() {
        presentation = new RecordingPresentationSurface();
        cases = new CaseContextTracker();
        props = new ReportProperties();
        handler = new ShowReportHandler(presentation, cases, props);
        cases.observe("ACC1");
    }

    private void show() {
        handler.handle(ActionRequest.of(ActionKind.SHOW_REPORT, ActionSources.HOTKEY));
    }

    @Test
    void nothingToShow() {
        // Act
        show();

        // Assert
        assertThat(presentation.lastToast()).isEqualTo("No report to show");
        assertThat(presentation.reports()).isEmpty();
    }

    @Test
    void showsWithoutBaselineBeforeProcess() {
        // Arrange
        cases.captureBaseline("FINDINGS: old");
        cases.recordReportText("FINDINGS: new");

        // Act
        show();

        // Assert
        assertThat(presentation.reports()).containsExactly(new ReportShown("FINDINGS: new", null));
    }

    @Test
    void highlightsAgainstBaselineAfterProcess() {
        // Arrange
        cases.captureBaseline("FINDINGS: old");
        cases.markProcessPressed();
        cases.recordReportText("FINDINGS: new");

        // Act
        show();

        // Assert
        assertThat(presentation.reports()).containsExactly(new ReportShown("FINDINGS: new", "FINDINGS: old"));
    }

    @Test
    void changeTrackingOffShowsPlainReport() {
        // Arrange
        props.setTrackChanges(false);
        cases.captureBaseline("FINDINGS: old");
        cases.markProcessPressed();
        cases.recordReportText("FINDINGS: new");

        // Act
        show();

        // Assert
        assertThat(presentation.reports()).containsExactly(new ReportShown("FINDINGS: new", null));
    }

    @Test
    void secondPressHides() {
        // Arrange
        cases.recordReportText("FINDINGS: new");
        show();

        // Act
        show();

        // Assert
        assertThat(presentation.isReportVisible()).isFalse();
        assertThat(presentation.reports()).hasSize(1);
    }
}
