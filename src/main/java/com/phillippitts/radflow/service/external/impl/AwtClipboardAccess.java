package com.phillippitts.radflow.service.external.impl;

import com.phillippitts.radflow.exception.RadFlowException;
import com.phillippitts.radflow.service.external.ClipboardAccess;
import com.phillippitts.radflow.util.Pause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Optional;

/** System clipboard via AWT. The clipboard is resolved lazily so startup works headless. */
@Component
class AwtClipboardAccess implements ClipboardAccess {

    private static final Logger LOG = LogManager.getLogger(AwtClipboardAccess.class);
    private static final int SET_ATTEMPTS = 3;
    private static final long RETRY_PAUSE_MS = 50;

    interface ClipboardFacade {
        Clipboard getSystemClipboard();
    }

    static final class AwtClipboardFacade implements ClipboardFacade {
        @Override
        public Clipboard getSystemClipboard() {
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        }
    }

    private final ClipboardFacade clipboard;
    private final Pause pause;

    @Autowired
    AwtClipboardAccess(Pause pause) {
        this(new AwtClipboardFacade(), pause);
    }

    // package-private for tests
    AwtClipboardAccess(ClipboardFacade facade, Pause pause) {
        this.clipboard = facade;
        this.pause = pause;
    }

    @Override
    public void setText(String text) {
        StringSelection selection = new StringSelection(text == null ? "" : text);
        IllegalStateException last = null;
        // Another process can hold the clipboard briefly
        for (int attempt = 1; attempt <= SET_ATTEMPTS; attempt++) {
            try {
                clipboard.getSystemClipboard().setContents(selection, null);
                return;
            } catch (IllegalStateException e) {
                last = e;
                LOG.debug("Clipboard busy (attempt {}/{})", attempt, SET_ATTEMPTS);
                pause.pause(RETRY_PAUSE_MS);
            }
        }
        throw new RadFlowException("Clipboard unavailable", last);
    }

    @Override
    public Optional<String> getText() {
        try {
            Clipboard cb = clipboard.getSystemClipboard();
            if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                return Optional.ofNullable((String) cb.getData(DataFlavor.stringFlavor));
            }
            return Optional.empty();
        } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
            LOG.debug("Clipboard read failed: {}", e.toString());
            return Optional.empty();
        }
    }
}
