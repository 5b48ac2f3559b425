package com.phillippitts.dualscribe.service.orchestration.event;

import com.phillippitts.dualscribe.domain.SessionSummary;

import java.time.Instant;

/**
 * Published once per recording after teardown finished.
 *
 * @param sessionId transcript session that was sealed
 * @param summary   its summary, or {@code null} if sealing failed
 * @param at        completion time
 */
public record RecordingStoppedEvent(String sessionId, SessionSummary summary, Instant at) {}
