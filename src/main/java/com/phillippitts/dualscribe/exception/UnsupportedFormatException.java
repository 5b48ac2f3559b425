package com.phillippitts.dualscribe.exception;

/**
 * Thrown when incoming audio is in a format that cannot be converted to canonical PCM16LE mono 16 kHz.
 */
public class UnsupportedFormatException extends DualScribeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
