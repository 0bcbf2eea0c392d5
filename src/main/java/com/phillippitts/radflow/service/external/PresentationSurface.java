package com.phillippitts.radflow.service.external;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import com.phillippitts.radflow.domain.AlertKind;
import com.phillippitts.radflow.domain.AlertState;

import java.util.List;
import java.util.Map;

/**
 * Floating windows and notifications shown to the user. Rendering is up to the
 * implementation; the core only decides what is shown and when.
 */
public interface PresentationSurface {

    void showToast(String message, int durationMs);

    /** Modal notice the user must acknowledge. */
    void showBlockingNotice(String title, String message);

    /** Shows (or replaces the content of) the single alerts-only surface. */
    void showAlertSurface(AlertKind kind, String details);

    void hideAlertSurface();

    boolean isAlertSurfaceVisible();

    /** Renders every indicator at once (always-show mode). */
    void renderIndicators(AlertState state);

    void updateRecordingIndicator(boolean recording);

    /** Shows the impression surface if hidden and sets its text. */
    void updatePresentation(String impressionText);

    void hidePresentation();

    boolean isPresentationVisible();

    /**
     * Shows the report, highlighting additions relative to {@code baseline} when non-null.
     */
    void showReport(String reportText, String baseline);

    void hideReport();

    boolean isReportVisible();

    void showPickLists(List<TextInsertionProperties.PickList> pickLists);

    /** Re-asserts that overlay windows stay above the external applications. */
    void ensureOverlaysOnTop();

    /** Current state for status endpoints. */
    default Map<String, Object> describe() {
        return Map.of();
    }
}
