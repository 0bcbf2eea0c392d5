package com.phillippitts.radflow.exception;

/**
 * Base exception for all RadFlow application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class RadFlowException extends RuntimeException {

    public RadFlowException(String message) {
        super(message);
    }

    public RadFlowException(String message, Throwable cause) {
        super(message, cause);
    }

    public RadFlowException(Throwable cause) {
        super(cause);
    }
}
