package com.phillippitts.radflow.exception;

/**
 * Thrown when a read probe against an external application fails (unreachable,
 * unparseable, window not found). Callers treat this as an unknown reading.
 */
public class ProbeException extends RadFlowException {

    private final String probe;

    public ProbeException(String probe, String message) {
        super(message);
        this.probe = probe;
    }

    public ProbeException(String probe, String message, Throwable cause) {
        super(message, cause);
        this.probe = probe;
    }

    /**
     * @return name of the probe that failed (e.g. "case-snapshot")
     */
    public String getProbe() {
        return probe;
    }
}
