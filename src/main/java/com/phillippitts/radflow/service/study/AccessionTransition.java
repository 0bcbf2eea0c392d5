package com.phillippitts.radflow.service.study;

import com.phillippitts.radflow.domain.TerminalOutcome;

/**
 * Result of feeding one scraped accession to {@link CaseContextTracker#observe(String)}.
 *
 * @param changed           the live case changed on this observation
 * @param previousAccession case that was left, null if none was open
 * @param outcome           terminal outcome of the previous case, null if none was open
 * @param newAccession      case now open, null if the case closed
 */
public record AccessionTransition(boolean changed,
                                  String previousAccession,
                                  TerminalOutcome outcome,
                                  String newAccession) {

    static AccessionTransition unchanged() {
        return new AccessionTransition(false, null, null, null);
    }

    public boolean closedPrevious() {
        return previousAccession != null;
    }

    public boolean openedNew() {
        return newAccession != null;
    }
}
