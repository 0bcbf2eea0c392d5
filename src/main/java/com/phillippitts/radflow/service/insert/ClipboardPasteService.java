package com.phillippitts.radflow.service.insert;

import com.phillippitts.radflow.service.external.ClipboardAccess;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.util.LogSanitizer;
import com.phillippitts.radflow.util.Pause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pastes text into the reporting app through the system clipboard.
 *
 * <p>Every paste path (macros, pick lists) goes through {@link #paste(String, String)}, which holds
 * a single lock from setting the clipboard until the paste keystroke has landed.
 */
@Service
public class ClipboardPasteService {

    private static final Logger LOG = LogManager.getLogger(ClipboardPasteService.class);

    static final long CLIPBOARD_SETTLE_MS = 50;
    static final long ACTIVATION_PAUSE_MS = 100;
    static final long PASTE_SETTLE_MS = 100;
    static final int TOAST_MS = 1500;

    private final ClipboardAccess clipboard;
    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final Pause pause;
    private final Clock clock;
    private final ReentrantLock pasteLock = new ReentrantLock();

    private volatile Instant lastPasteAt;

    public ClipboardPasteService(ClipboardAccess clipboard,
                                 ExternalCommander commander,
                                 PresentationSurface presentation,
                                 Pause pause,
                                 Clock clock) {
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard must not be null");
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param text  text to paste; blank text is ignored
     * @param label what was pasted, for the confirmation toast
     * @return true if the paste keystroke was sent
     */
    public boolean paste(String text, String label) {
        if (text == null || text.isBlank()) {
            return false;
        }
        pasteLock.lock();
        try {
            clipboard.setText(text);
            pause.pause(CLIPBOARD_SETTLE_MS);
            commander.activateExternalApp();
            pause.pause(ACTIVATION_PAUSE_MS);
            boolean sent = commander.emitKeystroke(ExternalCommand.PASTE);
            pause.pause(PASTE_SETTLE_MS);
            if (!sent) {
                LOG.warn("Paste keystroke not sent for {}", label);
                presentation.showToast("Paste failed", TOAST_MS);
                return false;
            }
            lastPasteAt = clock.instant();
            LOG.debug("Pasted {} ({} chars): {}", label, text.length(), LogSanitizer.preview(text));
            presentation.showToast("Inserted " + label, TOAST_MS);
            return true;
        } finally {
            pasteLock.unlock();
        }
    }

    /** @return when the last successful paste happened, null if never */
    public Instant lastPasteAt() {
        return lastPasteAt;
    }
}
