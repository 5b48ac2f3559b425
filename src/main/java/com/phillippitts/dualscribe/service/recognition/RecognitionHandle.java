package com.phillippitts.dualscribe.service.recognition;

import java.util.concurrent.CompletableFuture;

/**
 * An open duplex connection to a recognizer for one stream.
 */
public interface RecognitionHandle {

    /**
     * Sends canonical PCM (16 kHz, mono, 16-bit signed little-endian). Called from a single thread.
     */
    void send(byte[] pcm);

    /**
     * Flushes buffered audio and ends the connection. The future completes once any pending final
     * result has been delivered to the listener.
     */
    CompletableFuture<Void> close();
}
