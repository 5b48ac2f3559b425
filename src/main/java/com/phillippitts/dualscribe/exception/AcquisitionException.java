package com.phillippitts.dualscribe.exception;

/**
 * Thrown when an audio source cannot be opened (device missing, busy, or permission denied).
 */
public class AcquisitionException extends DualScribeException {

    private final String source;
    private final String reason;

    public AcquisitionException(String source, String reason, String message) {
        super(message);
        this.source = source;
        this.reason = reason;
    }

    public AcquisitionException(String source, String reason, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.reason = reason;
    }

    /** Stream wire name of the source that failed. */
    public String getSource() {
        return source;
    }

    /** Short machine-readable reason such as {@code DEVICE_UNAVAILABLE} or {@code PERMISSION_DENIED}. */
    public String getReason() {
        return reason;
    }
}
