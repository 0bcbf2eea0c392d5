package com.phillippitts.radflow.service.external.impl;

import com.phillippitts.radflow.config.properties.ExternalAppProperties;
import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.exception.ProbeException;
import com.phillippitts.radflow.service.external.ExternalOracle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Oracle fed by an external scraper process that pushes readings over REST.
 *
 * <p>Each reading is timestamped on arrival. A reading older than
 * {@code external.oracle-staleness-ms}, or one never pushed, probes as unknown, so a dead
 * scraper degrades to "unknown" rather than to a frozen last value. A scraper that
 * reports a failed case scrape makes {@link #probeCaseSnapshot()} throw
 * {@link ProbeException} until the next snapshot arrives.
 */
@Component
public class PushedStateOracle implements ExternalOracle {

    private static final Logger LOG = LogManager.getLogger(PushedStateOracle.class);

    private record Reading<T>(T value, Instant at) { }

    private record Classified(String accession, CaseClassification classification) { }

    private final ExternalAppProperties props;
    private final Clock clock;

    private volatile Reading<Boolean> recording;
    private volatile Reading<CaseSnapshot> snapshot;
    private volatile Reading<Boolean> discardDialog;
    private volatile Reading<String> caseFailure;
    private volatile Classified classified;

    public PushedStateOracle(ExternalAppProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void pushRecordingActive(boolean active) {
        recording = new Reading<>(active, clock.instant());
    }

    public void pushCaseSnapshot(CaseSnapshot value) {
        Objects.requireNonNull(value, "snapshot must not be null");
        snapshot = new Reading<>(value, clock.instant());
        caseFailure = null;
        LOG.debug("Case snapshot pushed: accession={}", value.accessionOrEmpty());
    }

    /**
     * Records that the scraper could not read the case. Clears the last snapshot.
     */
    public void pushCaseProbeFailure(String reason) {
        snapshot = null;
        caseFailure = new Reading<>(reason == null ? "unknown" : reason, clock.instant());
        LOG.debug("Case probe failure pushed: {}", caseFailure.value());
    }

    public void pushDiscardDialogVisible(boolean visible) {
        discardDialog = new Reading<>(visible, clock.instant());
    }

    public void pushCaseClassification(String accession, CaseClassification classification) {
        Objects.requireNonNull(accession, "accession must not be null");
        classified = new Classified(accession, classification);
    }

    @Override
    public Optional<Boolean> probeRecordingActive() {
        return fresh(recording);
    }

    @Override
    public Optional<CaseSnapshot> probeCaseSnapshot() {
        Optional<String> failure = fresh(caseFailure);
        if (failure.isPresent()) {
            throw new ProbeException("case", "Case scrape failed: " + failure.get());
        }
        return fresh(snapshot);
    }

    @Override
    public Optional<Boolean> probeDiscardDialogVisible() {
        return fresh(discardDialog);
    }

    @Override
    public Optional<CaseClassification> probeCaseClassification(String accession) {
        Classified c = classified;
        if (c == null || accession == null || !c.accession().equals(accession)) {
            return Optional.empty();
        }
        return Optional.ofNullable(c.classification());
    }

    private <T> Optional<T> fresh(Reading<T> reading) {
        if (reading == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(reading.at(), clock.instant());
        if (age.toMillis() > props.getOracleStalenessMs()) {
            return Optional.empty();
        }
        return Optional.of(reading.value());
    }
}
