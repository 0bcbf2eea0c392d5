package com.phillippitts.radflow.service.study;

import com.phillippitts.radflow.domain.TerminalOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single live {@link CaseContext}.
 *
 * <p>The poller feeds it scraped accessions; actions mark what happened to the case
 * (process, sign, discard). All state is guarded by one lock since the poller thread and
 * the action worker both write it.
 *
 * <p>Change detection: a new non-empty accession that differs from the live one, or an empty
 * accession while a case is live. On change the previous case's terminal outcome is
 * {@link TerminalOutcome#SIGNED} if a sign ran, else {@link TerminalOutcome#CLOSED_UNSIGNED}
 * if a discard was seen, else {@link TerminalOutcome#SIGNED}.
 */
@Component
public class CaseContextTracker {

    private static final Logger LOG = LogManager.getLogger(CaseContextTracker.class);

    private final ReentrantLock lock = new ReentrantLock();

    private String accession;
    private String description;
    private boolean signed;
    private boolean discardRequested;
    private String baselineReport;
    private boolean processPressed;
    private boolean protocolFlag;
    private String pendingMacros;
    private boolean criticalNoteRequested;
    private String lastReportText;

    /** Case closed by a discard action that the oracle may still report for a cycle or two. */
    private String lastTerminatedAccession;

    /**
     * Feeds one scraped accession. Null and blank mean "no case open".
     */
    public AccessionTransition observe(String scraped) {
        String next = scraped == null ? "" : scraped.trim();
        lock.lock();
        try {
            if (lastTerminatedAccession != null) {
                if (next.equals(lastTerminatedAccession) && accession == null) {
                    return AccessionTransition.unchanged();
                }
                lastTerminatedAccession = null;
            }
            String prev = accession == null ? "" : accession;
            boolean changed = (!next.isEmpty() && !next.equals(prev)) || (!prev.isEmpty() && next.isEmpty());
            if (!changed) {
                return AccessionTransition.unchanged();
            }
            TerminalOutcome outcome = prev.isEmpty() ? null : outcomeOfLiveCase();
            clear();
            accession = next.isEmpty() ? null : next;
            LOG.info("Case changed: {} -> {}", prev.isEmpty() ? "(none)" : prev, next.isEmpty() ? "(none)" : next);
            return new AccessionTransition(true, prev.isEmpty() ? null : prev, outcome, accession);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the live case after a successful discard and remembers it so a lagging oracle
     * does not reopen it.
     *
     * @return the accession that was closed, empty if no case was open
     */
    public Optional<String> closeAfterDiscard() {
        lock.lock();
        try {
            String closed = accession;
            clear();
            lastTerminatedAccession = closed;
            return Optional.ofNullable(closed);
        } finally {
            lock.unlock();
        }
    }

    public CaseContext current() {
        lock.lock();
        try {
            return new CaseContext(accession, description, signed, discardRequested, baselineReport,
                    processPressed, protocolFlag, pendingMacros, criticalNoteRequested);
        } finally {
            lock.unlock();
        }
    }

    public String currentAccession() {
        lock.lock();
        try {
            return accession;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCaseOpen() {
        return currentAccession() != null;
    }

    public void updateDescription(String scraped) {
        if (scraped == null || scraped.isBlank()) {
            return;
        }
        withLock(() -> {
            if (accession != null) {
                description = scraped.trim();
            }
        });
    }

    public void markSigned() {
        withLock(() -> signed = true);
    }

    public void markDiscardObserved() {
        withLock(() -> discardRequested = true);
    }

    public void markProcessPressed() {
        withLock(() -> processPressed = true);
    }

    public void setProtocolFlag(boolean flag) {
        withLock(() -> protocolFlag = flag);
    }

    /**
     * Stores the baseline unless one already exists for the live case.
     *
     * @return true if captured on this call
     */
    public boolean captureBaseline(String reportText) {
        lock.lock();
        try {
            if (accession == null || baselineReport != null) {
                return false;
            }
            baselineReport = reportText;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void setPendingMacros(String text) {
        withLock(() -> pendingMacros = text);
    }

    /**
     * @return pending macro text, clearing it; empty when there is none
     */
    public Optional<String> takePendingMacros() {
        lock.lock();
        try {
            String text = pendingMacros;
            pendingMacros = null;
            return Optional.ofNullable(text);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true the first time it is called for the live case
     */
    public boolean markCriticalNoteRequested() {
        lock.lock();
        try {
            if (accession == null || criticalNoteRequested) {
                return false;
            }
            criticalNoteRequested = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void recordReportText(String text) {
        withLock(() -> lastReportText = text);
    }

    /** Last report text the poller scraped, null before the first scrape. */
    public String lastReportText() {
        lock.lock();
        try {
            return lastReportText;
        } finally {
            lock.unlock();
        }
    }

    private TerminalOutcome outcomeOfLiveCase() {
        if (signed) {
            return TerminalOutcome.SIGNED;
        }
        if (discardRequested) {
            return TerminalOutcome.CLOSED_UNSIGNED;
        }
        return TerminalOutcome.SIGNED;
    }

    private void clear() {
        accession = null;
        description = null;
        signed = false;
        discardRequested = false;
        baselineReport = null;
        processPressed = false;
        protocolFlag = false;
        pendingMacros = null;
        criticalNoteRequested = false;
        lastReportText = null;
    }

    private void withLock(Runnable r) {
        lock.lock();
        try {
            r.run();
        } finally {
            lock.unlock();
        }
    }
}
