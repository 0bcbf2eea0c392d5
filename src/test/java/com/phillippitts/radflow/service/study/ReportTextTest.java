package com.phillippitts.radflow.service.study;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportTextTest {

    private static final String REPORT = """
            EXAM: CT HEAD WITHOUT CONTRAST
            CLINICAL HISTORY: Sudden onset   left sided weakness.
            FINDINGS:
            No hemorrhage.
            IMPRESSION:
            1. No acute intracranial
               abnormality.  2. Chronic microvascular change.
            RECOMMENDATION: None.
            """;

    @Test
    void extractsImpressionWithNumberedItemsOnOwnLines() {
        // Act
        String impression = ReportText.extractImpression(REPORT);

        // Assert
        assertThat(impression).isEqualTo("1. No acute intracranial abnormality.\n2. Chronic microvascular change.");
    }

    @Test
    void impressionAtEndOfReportRunsToEnd() {
        // Act
        String impression = ReportText.extractImpression("FINDINGS: normal\nImpression: Normal study.");

        // Assert
        assertThat(impression).isEqualTo("Normal study.");
    }

    @Test
    void missingImpressionIsEmpty() {
        assertThat(ReportText.extractImpression("FINDINGS: normal")).isEmpty();
        assertThat(ReportText.extractImpression(null)).isEmpty();
        assertThat(ReportText.extractImpression("   ")).isEmpty();
    }

    @Test
    void extractsClinicalHistoryCollapsed() {
        assertThat(ReportText.clinicalHistory(REPORT)).isEqualTo("Sudden onset left sided weakness.");
        assertThat(ReportText.clinicalHistory("FINDINGS: x")).isEmpty();
    }

    @Test
    void detectsClinicalHistoryMarkerCaseInsensitively() {
        assertThat(ReportText.hasClinicalHistory("clinical history: pain")).isTrue();
        assertThat(ReportText.hasClinicalHistory("FINDINGS: x")).isFalse();
        assertThat(ReportText.hasClinicalHistory(null)).isFalse();
    }

    @Test
    void countsLines() {
        assertThat(ReportText.lineCount(null)).isZero();
        assertThat(ReportText.lineCount("")).isZero();
        assertThat(ReportText.lineCount("one")).isEqualTo(1);
        assertThat(ReportText.lineCount("one\r\ntwo\nthree")).isEqualTo(3);
    }
}
