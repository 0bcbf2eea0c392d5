package com.phillippitts.radflow.domain;

import java.util.List;
import java.util.Optional;

/**
 * Alert conditions computed from one poll cycle. Recomputed every cycle and never persisted.
 *
 * @param genderMismatch   report mentions anatomy inconsistent with the patient's gender
 * @param templateMismatch study description and report template name cover different body parts
 * @param protocolFlag     case was classified as a protocol case (stroke) when it opened
 * @param drafted          report is in drafted state; rendered as an indicator in always-show mode
 * @param genderTerms      conflicting terms found, empty when no mismatch
 * @param templateDetails  human-readable description/template pair, null when no mismatch
 */
public record AlertState(boolean genderMismatch,
                         boolean templateMismatch,
                         boolean protocolFlag,
                         boolean drafted,
                         List<String> genderTerms,
                         String templateDetails) {

    public AlertState {
        genderTerms = genderTerms == null ? List.of() : List.copyOf(genderTerms);
    }

    public static AlertState none() {
        return new AlertState(false, false, false, false, List.of(), null);
    }

    public boolean isActive(AlertKind kind) {
        return switch (kind) {
            case GENDER_MISMATCH -> genderMismatch;
            case TEMPLATE_MISMATCH -> templateMismatch;
            case PROTOCOL_FLAG -> protocolFlag;
        };
    }

    /**
     * The single alert to present: the highest-priority active condition.
     */
    public Optional<AlertKind> selected() {
        for (AlertKind kind : AlertKind.values()) {
            if (isActive(kind)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Details text for an alert surface showing {@code kind}.
     */
    public String detailsFor(AlertKind kind) {
        return switch (kind) {
            case GENDER_MISMATCH -> "Report mentions: " + String.join(", ", genderTerms);
            case TEMPLATE_MISMATCH -> templateDetails == null ? "" : templateDetails;
            case PROTOCOL_FLAG -> "Stroke protocol";
        };
    }
}
