package com.phillippitts.radflow.domain;

/**
 * How a case ended, as reported once per case when it is left.
 */
public enum TerminalOutcome {
    SIGNED("signed"),
    CLOSED_UNSIGNED("unsigned");

    private final String wireName;

    TerminalOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
