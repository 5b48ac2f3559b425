package com.phillippitts.dualscribe.exception;

/**
 * Base exception for all dualscribe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DualScribeException extends RuntimeException {

    public DualScribeException(String message) {
        super(message);
    }

    public DualScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public DualScribeException(Throwable cause) {
        super(cause);
    }
}
