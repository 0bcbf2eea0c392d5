package com.phillippitts.radflow.exception;

/**
 * Thrown when a configured cross-reference (for example a pick-list item that pulls its
 * text from another list) points at a target that is missing or disabled.
 */
public class InvalidReferenceException extends RadFlowException {

    private final String reference;

    public InvalidReferenceException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
