package com.phillippitts.dualscribe.service.transcript.event;

import com.phillippitts.dualscribe.domain.SessionSummary;

import java.nio.file.Path;

/**
 * Published once per session when it is sealed.
 *
 * @param summary statistics of the sealed session
 * @param savedTo file written on seal, or {@code null} when not persisted
 */
public record SessionEndedEvent(SessionSummary summary, Path savedTo) {}
