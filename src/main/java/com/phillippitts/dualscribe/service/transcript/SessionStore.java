package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.TranscriptSession;
import com.phillippitts.dualscribe.exception.PersistenceException;

import java.nio.file.Path;

/**
 * Durable storage for session snapshots.
 */
public interface SessionStore {

    /**
     * Writes (or overwrites) the snapshot of a session.
     *
     * @return location written
     * @throws PersistenceException when the write fails
     */
    Path save(TranscriptSession session, SessionSummary summary);

    /**
     * Reads a snapshot written by {@link #save}.
     *
     * @throws PersistenceException when the file cannot be read or parsed
     */
    TranscriptSession load(Path path);
}
