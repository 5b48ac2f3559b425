package com.phillippitts.dualscribe.exception;

/**
 * Writing a session file failed. Non-fatal: in-memory transcripts stay authoritative.
 */
public class PersistenceException extends DualScribeException {

    private final String path;

    public PersistenceException(String path, Throwable cause) {
        super("Failed to persist session to " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
