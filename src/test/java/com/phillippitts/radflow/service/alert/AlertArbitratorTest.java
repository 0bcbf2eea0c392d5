package com.phillippitts.radflow.service.alert;

import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.domain.AlertKind;
import com.phillippitts.radflow.domain.AlertState;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertArbitratorTest {

    private RecordingPresentationSurface presentation;
    private AlertProperties props;
    private AlertArbitrator arbitrator;

    @BeforeEach
    void setUp() {
        presentation = new RecordingPresentationSurface();
        props = new AlertProperties();
        arbitrator = new AlertArbitrator(presentation, props);
    }

    private static CaseSnapshot snapshot(String text, String template, String description, String gender) {
        return new CaseSnapshot("ACC1", text, true, template, description, gender);
    }

    @Test
    void detectsTemplateMismatchWithDetails() {
        // Act
        AlertState state = arbitrator.evaluate(snapshot("", "CT CHEST", "CT HEAD WO", null), false);

        // Assert
        assertThat(state.templateMismatch()).isTrue();
        assertThat(state.templateDetails()).isEqualTo("Study: CT HEAD WO / Template: CT CHEST");
        assertThat(state.drafted()).isTrue();
        assertThat(state.selected()).contains(AlertKind.TEMPLATE_MISMATCH);
    }

    @Test
    void genderMismatchOutranksOtherAlerts() {
        // Arrange
        AlertState state = arbitrator.evaluate(
                snapshot("The prostate is enlarged.", "CT CHEST", "CT HEAD", "F"), true);

        // Act
        arbitrator.present(state);

        // Assert
        assertThat(state.genderMismatch()).isTrue();
        assertThat(state.templateMismatch()).isTrue();
        assertThat(state.protocolFlag()).isTrue();
        assertThat(presentation.alert()).isEqualTo(AlertKind.GENDER_MISMATCH);
        assertThat(presentation.alertDetails()).isEqualTo("Report mentions: prostate");
    }

    @Test
    void disabledChecksProduceNoAlerts() {
        // Arrange
        props.setGenderCheckEnabled(false);
        props.setTemplateCheckEnabled(false);
        props.setStrokeDetectionEnabled(false);

        // Act
        AlertState state = arbitrator.evaluate(
                snapshot("The prostate is enlarged.", "CT CHEST", "CT HEAD", "F"), true);

        // Assert
        assertThat(state.selected()).isEmpty();
        assertThat(state.genderTerms()).isEmpty();
    }

    @Test
    void nullSnapshotEvaluatesToNone() {
        assertThat(arbitrator.evaluate(null, true)).isEqualTo(AlertState.none());
    }

    @Test
    void unchangedAlertIsNotShownAgain() {
        // Arrange
        AlertState state = arbitrator.evaluate(snapshot("", "CT CHEST", "CT HEAD", null), false);

        // Act
        arbitrator.present(state);
        arbitrator.present(state);

        // Assert
        assertThat(presentation.alertsShown()).containsExactly(AlertKind.TEMPLATE_MISMATCH);
    }

    @Test
    void changedDetailsReplaceShownAlert() {
        // Arrange
        arbitrator.present(arbitrator.evaluate(snapshot("", "CT CHEST", "CT HEAD", null), false));

        // Act
        arbitrator.present(arbitrator.evaluate(snapshot("", "CT ABDOMEN", "CT HEAD", null), false));

        // Assert
        assertThat(presentation.alertsShown()).hasSize(2);
        assertThat(presentation.alertDetails()).isEqualTo("Study: CT HEAD / Template: CT ABDOMEN");
    }

    @Test
    void clearedConditionHidesSurface() {
        // Arrange
        arbitrator.present(arbitrator.evaluate(snapshot("", "CT CHEST", "CT HEAD", null), false));

        // Act
        arbitrator.present(arbitrator.evaluate(snapshot("", "CT HEAD", "CT HEAD", null), false));

        // Assert
        assertThat(presentation.isAlertSurfaceVisible()).isFalse();
        assertThat(presentation.alertHides()).isEqualTo(1);
    }

    @Test
    void alwaysShowModeRendersAllIndicators() {
        // Arrange
        props.setMode(AlertProperties.Mode.ALWAYS_SHOW);
        AlertState state = arbitrator.evaluate(snapshot("", "CT CHEST", "CT HEAD", null), true);

        // Act
        arbitrator.present(state);

        // Assert
        assertThat(presentation.indicatorRenders()).containsExactly(state);
        assertThat(presentation.alertsShown()).isEmpty();
    }

    @Test
    void resetHidesVisibleAlert() {
        // Arrange
        arbitrator.present(arbitrator.evaluate(snapshot("", null, null, null), true));

        // Act
        arbitrator.reset();

        // Assert
        assertThat(presentation.isAlertSurfaceVisible()).isFalse();
    }
}
