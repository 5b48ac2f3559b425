package com.phillippitts.dualscribe.service.transcript.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published after a session snapshot was written to disk.
 */
public record SessionSavedEvent(String sessionId, Path path, boolean sealed, Instant at) {}
