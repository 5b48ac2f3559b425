package com.phillippitts.dualscribe.service.transcript.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when a session snapshot could not be written. The in-memory session is unaffected.
 */
public record PersistenceFailedEvent(String sessionId, Path path, String message, Instant at) {
    public PersistenceFailedEvent {
        if (at == null) at = Instant.now();
    }
}
