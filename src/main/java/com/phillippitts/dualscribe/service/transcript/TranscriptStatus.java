package com.phillippitts.dualscribe.service.transcript;

import java.time.Instant;

/**
 * Point-in-time view of the transcript engine.
 *
 * @param sessionId        current or last sealed session, {@code null} before the first start
 * @param sessionActive    whether a session is open
 * @param sessionStart     start of {@code sessionId}
 * @param totalTranscripts entries in the log
 * @param interimCount     streams with a live hypothesis
 * @param policy           duplicate policy in force
 */
public record TranscriptStatus(String sessionId,
                               boolean sessionActive,
                               Instant sessionStart,
                               int totalTranscripts,
                               int interimCount,
                               DuplicatePolicy policy) {}
