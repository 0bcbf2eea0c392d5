package com.phillippitts.radflow.service.study.event;

import com.phillippitts.radflow.domain.TerminalOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal notification for a case that was left. Published exactly once per case.
 *
 * @param accession       the case that ended
 * @param outcome         signed or closed unsigned
 * @param hasCriticalNote a critical note was created for the case
 * @param at              when the change was detected
 */
public record CaseTerminatedEvent(String accession, TerminalOutcome outcome, boolean hasCriticalNote, Instant at) {
    public CaseTerminatedEvent {
        Objects.requireNonNull(accession, "accession");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(at, "at");
    }
}
