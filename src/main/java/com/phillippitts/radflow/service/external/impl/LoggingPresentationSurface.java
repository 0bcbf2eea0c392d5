package com.phillippitts.radflow.service.external.impl;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import com.phillippitts.radflow.domain.AlertKind;
import com.phillippitts.radflow.domain.AlertState;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Headless presentation: records what would be on screen and logs it. A desktop shell
 * replaces this bean with a real window layer.
 */
@Component
class LoggingPresentationSurface implements PresentationSurface {

    private static final Logger LOG = LogManager.getLogger(LoggingPresentationSurface.class);

    private volatile String lastToast;
    private volatile AlertKind alertShown;
    private volatile boolean presentationVisible;
    private volatile boolean reportVisible;
    private volatile boolean recordingIndicator;
    private volatile AlertState indicators = AlertState.none();

    @Override
    public void showToast(String message, int durationMs) {
        lastToast = message;
        LOG.info("Toast ({}ms): {}", durationMs, message);
    }

    @Override
    public void showBlockingNotice(String title, String message) {
        LOG.warn("Notice [{}]: {}", title, message);
    }

    @Override
    public void showAlertSurface(AlertKind kind, String details) {
        alertShown = kind;
        LOG.info("Alert surface: {} ({})", kind, details);
    }

    @Override
    public void hideAlertSurface() {
        if (alertShown != null) {
            LOG.info("Alert surface hidden");
        }
        alertShown = null;
    }

    @Override
    public boolean isAlertSurfaceVisible() {
        return alertShown != null;
    }

    @Override
    public void renderIndicators(AlertState state) {
        indicators = state;
    }

    @Override
    public void updateRecordingIndicator(boolean recording) {
        recordingIndicator = recording;
        LOG.debug("Recording indicator: {}", recording ? "on" : "off");
    }

    @Override
    public void updatePresentation(String impressionText) {
        presentationVisible = true;
        LOG.info("Impression: {}", LogSanitizer.preview(impressionText));
    }

    @Override
    public void hidePresentation() {
        presentationVisible = false;
    }

    @Override
    public boolean isPresentationVisible() {
        return presentationVisible;
    }

    @Override
    public void showReport(String reportText, String baseline) {
        reportVisible = true;
        LOG.info("Report shown ({} chars, diff={})", reportText == null ? 0 : reportText.length(), baseline != null);
    }

    @Override
    public void hideReport() {
        reportVisible = false;
    }

    @Override
    public boolean isReportVisible() {
        return reportVisible;
    }

    @Override
    public void showPickLists(List<TextInsertionProperties.PickList> pickLists) {
        LOG.info("Pick lists offered: {}", pickLists.stream().map(TextInsertionProperties.PickList::getName).toList());
    }

    @Override
    public void ensureOverlaysOnTop() {
        // nothing rendered
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("lastToast", lastToast);
        m.put("alert", alertShown);
        m.put("impressionVisible", presentationVisible);
        m.put("reportVisible", reportVisible);
        m.put("recordingIndicator", recordingIndicator);
        m.put("indicators", indicators);
        return m;
    }
}
