package com.phillippitts.radflow.service.alert;

import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.domain.AlertKind;
import com.phillippitts.radflow.domain.AlertState;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.service.external.PresentationSurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Computes the alert conditions for one poll cycle and drives their presentation.
 *
 * <p>In {@link AlertProperties.Mode#ALERTS_ONLY} mode a single surface shows the
 * highest-priority active condition (gender mismatch, then template mismatch, then the
 * protocol flag) and is hidden when nothing is active. In
 * {@link AlertProperties.Mode#ALWAYS_SHOW} mode every indicator is rendered each cycle.
 *
 * <p>Called only from the study poller thread.
 */
@Component
public class AlertArbitrator {

    private static final Logger LOG = LogManager.getLogger(AlertArbitrator.class);

    private final PresentationSurface presentation;
    private final AlertProperties props;

    private AlertKind shown;
    private String shownDetails;

    public AlertArbitrator(PresentationSurface presentation, AlertProperties props) {
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    public AlertState evaluate(CaseSnapshot snapshot, boolean protocolFlag) {
        if (snapshot == null) {
            return AlertState.none();
        }
        boolean templateMismatch = false;
        String templateDetails = null;
        if (props.isTemplateCheckEnabled()
                && !BodyPartMatcher.matches(snapshot.description(), snapshot.templateName())) {
            templateMismatch = true;
            templateDetails = "Study: " + snapshot.description() + " / Template: " + snapshot.templateName();
        }

        List<String> genderTerms = props.isGenderCheckEnabled()
                ? GenderTermChecker.conflictingTerms(snapshot.reportText(), snapshot.patientGender())
                : List.of();

        boolean flagged = props.isStrokeDetectionEnabled() && protocolFlag;
        return new AlertState(!genderTerms.isEmpty(), templateMismatch, flagged,
                snapshot.isDrafted(), genderTerms, templateDetails);
    }

    /**
     * Applies {@code state} to the presentation surface according to the configured mode.
     */
    public void present(AlertState state) {
        if (props.getMode() == AlertProperties.Mode.ALWAYS_SHOW) {
            presentation.renderIndicators(state);
            return;
        }
        AlertKind selected = state.selected().orElse(null);
        if (selected == null) {
            hide();
            return;
        }
        String details = state.detailsFor(selected);
        if (selected != shown || !details.equals(shownDetails) || !presentation.isAlertSurfaceVisible()) {
            LOG.info("Showing alert {}", selected);
            presentation.showAlertSurface(selected, details);
            shown = selected;
            shownDetails = details;
        }
    }

    /** Hides the alert surface if it is visible and forgets what was shown. */
    public void reset() {
        hide();
    }

    private void hide() {
        if (shown != null || presentation.isAlertSurfaceVisible()) {
            presentation.hideAlertSurface();
        }
        shown = null;
        shownDetails = null;
    }
}
