package com.phillippitts.radflow.service.study;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Section extraction from scraped report text.
 */
public final class ReportText {

    private static final String HEADERS =
            "TECHNIQUE|FINDINGS|CLINICAL HISTORY|COMPARISON|EXAM|PROCEDURE|INDICATION|IMPRESSION"
                    + "|CONCLUSION|RECOMMENDATION|SIGNATURE|ELECTRONICALLY SIGNED";

    private static final Pattern IMPRESSION = Pattern.compile(
            "IMPRESSION[:\\s]*\\n?(.+?)(?=\\n\\s*(" + HEADERS + ")\\s*[:\\n]|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CLINICAL_HISTORY = Pattern.compile(
            "CLINICAL HISTORY[:\\s]*\\n?(.+?)(?=\\n\\s*(" + HEADERS + ")\\s*[:\\n]|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern NUMBERED_ITEM = Pattern.compile("\\s+(\\d+\\.)\\s");

    /** Marker that the reporting app has laid out the report template. */
    public static final String CLINICAL_HISTORY_MARKER = "CLINICAL HISTORY";

    private ReportText() {}

    /**
     * Text of the IMPRESSION section with whitespace collapsed and each numbered item
     * on its own line.
     *
     * @return extracted text, or "" when there is no impression section or it is empty
     */
    public static String extractImpression(String reportText) {
        String raw = section(IMPRESSION, reportText);
        if (raw.isEmpty()) {
            return "";
        }
        String collapsed = raw.replaceAll("\\s+", " ").trim();
        return NUMBERED_ITEM.matcher(collapsed).replaceAll("\n$1 ").trim();
    }

    /**
     * @return CLINICAL HISTORY section text with whitespace collapsed, or ""
     */
    public static String clinicalHistory(String reportText) {
        return section(CLINICAL_HISTORY, reportText).replaceAll("\\s+", " ").trim();
    }

    public static boolean hasClinicalHistory(String reportText) {
        return reportText != null && reportText.toUpperCase(Locale.ROOT).contains(CLINICAL_HISTORY_MARKER);
    }

    /**
     * @return number of lines, 0 for null or empty text
     */
    public static int lineCount(String reportText) {
        if (reportText == null || reportText.isEmpty()) {
            return 0;
        }
        return reportText.split("\\r?\\n", -1).length;
    }

    private static String section(Pattern pattern, String reportText) {
        if (reportText == null || reportText.isBlank()) {
            return "";
        }
        Matcher m = pattern.matcher(reportText);
        return m.find() ? m.group(1).trim() : "";
    }
}
