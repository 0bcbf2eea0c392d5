package com.phillippitts.radflow.domain;

import java.util.Locale;

/**
 * Worklist classification of the open case (priority and class columns), read once when
 * a case opens.
 */
public record CaseClassification(String priority, String classification) {

    public boolean mentions(String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        return contains(priority, needle) || contains(classification, needle);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
