package com.phillippitts.radflow.service.note;

import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Creates the critical-result follow-up note at most once per accession.
 *
 * <p>The accession is recorded only when the note command succeeds, so a failed attempt
 * can be retried. {@link #reset()} is called when the open case changes.
 */
@Component
public class CriticalNoteTracker {

    private static final Logger LOG = LogManager.getLogger(CriticalNoteTracker.class);
    static final int TOAST_MS = 2500;

    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final ReentrantLock lock = new ReentrantLock();

    private String createdForAccession;

    public CriticalNoteTracker(ExternalCommander commander, PresentationSurface presentation) {
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
    }

    /**
     * Creates the note for {@code accession} unless one was already created for it.
     *
     * @return true if the note command was sent and succeeded on this call
     */
    public boolean ensureNoteForAccession(String accession) {
        if (accession == null || accession.isBlank()) {
            return false;
        }
        lock.lock();
        try {
            if (accession.equals(createdForAccession)) {
                LOG.debug("Critical note already created for {}", accession);
                return false;
            }
            if (!commander.emitKeystroke(ExternalCommand.CREATE_CRITICAL_NOTE)) {
                LOG.warn("Critical note creation failed for {}", accession);
                presentation.showToast("Critical note failed - create manually", TOAST_MS);
                return false;
            }
            createdForAccession = accession;
        } finally {
            lock.unlock();
        }
        LOG.info("Critical note created for {}", accession);
        presentation.showToast("Critical note created", TOAST_MS);
        return true;
    }

    public boolean hasCriticalNoteFor(String accession) {
        lock.lock();
        try {
            return accession != null && accession.equals(createdForAccession);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            createdForAccession = null;
        } finally {
            lock.unlock();
        }
    }
}
