package com.phillippitts.radflow.testutil;

import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.exception.ProbeException;
import com.phillippitts.radflow.service.external.ExternalOracle;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable oracle. Every probe returns whatever the test last set; unset probes are unknown.
 */
public class FakeOracle implements ExternalOracle {

    private volatile Boolean recording;
    private volatile CaseSnapshot snapshot;
    private volatile boolean caseProbeFails;
    private volatile Boolean discardDialog;
    private final Map<String, CaseClassification> classifications = new HashMap<>();
    private final AtomicInteger caseProbes = new AtomicInteger();

    public void setRecording(Boolean recording) {
        this.recording = recording;
    }

    public void setSnapshot(CaseSnapshot snapshot) {
        this.snapshot = snapshot;
        this.caseProbeFails = false;
    }

    /** Shorthand for a snapshot carrying only an accession and report text. */
    public void setCase(String accession, String reportText) {
        setSnapshot(new CaseSnapshot(accession, reportText, null, null, null, null));
    }

    public void failCaseProbe() {
        this.caseProbeFails = true;
    }

    public void setDiscardDialog(Boolean visible) {
        this.discardDialog = visible;
    }

    public void setClassification(String accession, CaseClassification classification) {
        classifications.put(accession, classification);
    }

    public int caseProbeCount() {
        return caseProbes.get();
    }

    @Override
    public Optional<Boolean> probeRecordingActive() {
        return Optional.ofNullable(recording);
    }

    @Override
    public Optional<CaseSnapshot> probeCaseSnapshot() {
        caseProbes.incrementAndGet();
        if (caseProbeFails) {
            throw new ProbeException("case", "scripted failure");
        }
        return Optional.ofNullable(snapshot);
    }

    @Override
    public Optional<Boolean> probeDiscardDialogVisible() {
        return Optional.ofNullable(discardDialog);
    }

    @Override
    public Optional<CaseClassification> probeCaseClassification(String accession) {
        return Optional.ofNullable(classifications.get(accession));
    }
}
