package com.phillippitts.radflow.service.external;

import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.domain.CaseSnapshot;

import java.util.Optional;

/**
 * Read-only probes against the external applications.
 *
 * <p>Every probe may return empty (unknown). Probes are not atomic with respect to each
 * other and may lag the real state by up to one polling interval. Implementations may
 * throw {@link com.phillippitts.radflow.exception.ProbeException}; callers treat that
 * as unknown for the current cycle.
 */
public interface ExternalOracle {

    /** @return whether the reporting app is currently recording dictation */
    Optional<Boolean> probeRecordingActive();

    /** @return the currently open case as scraped from the reporting app */
    Optional<CaseSnapshot> probeCaseSnapshot();

    /** @return whether the reporting app is showing its "discard study" confirmation */
    Optional<Boolean> probeDiscardDialogVisible();

    /** @return worklist classification for {@code accession}, read once per case */
    Optional<CaseClassification> probeCaseClassification(String accession);
}
