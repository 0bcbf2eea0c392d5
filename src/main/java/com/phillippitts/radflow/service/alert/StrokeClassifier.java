package com.phillippitts.radflow.service.alert;

import com.phillippitts.radflow.config.properties.AlertProperties;
import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.service.study.ReportText;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides, once per case, whether the case is a stroke-protocol case.
 */
@Component
public class StrokeClassifier {

    private static final String STROKE = "stroke";

    private final AlertProperties props;

    public StrokeClassifier(AlertProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @param classification worklist classification, null when unknown
     * @param reportText     current report text, only consulted when the keyword scan is on
     */
    public boolean isProtocolCase(CaseClassification classification, String reportText) {
        if (!props.isStrokeDetectionEnabled()) {
            return false;
        }
        if (classification != null && classification.mentions(STROKE)) {
            return true;
        }
        if (!props.isStrokeKeywordScan()) {
            return false;
        }
        String history = ReportText.clinicalHistory(reportText);
        if (history.isEmpty()) {
            return false;
        }
        for (String keyword : props.getStrokeKeywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            Pattern p = Pattern.compile("\\b" + Pattern.quote(keyword.trim()) + "\\b", Pattern.CASE_INSENSITIVE);
            if (p.matcher(history).find()) {
                return true;
            }
        }
        return false;
    }
}
