package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.TranscriptSession;
import com.phillippitts.dualscribe.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Stores one pretty-printed JSON document per session under a directory.
 *
 * <p>File name: {@code session_<start ISO-8601 with ':' and '.' replaced by '-'>.json}. Repeated saves
 * of the same session overwrite the file. Writes go to a temporary sibling first and are moved into
 * place, so a reader never observes a half-written document.
 */
public class JsonFileSessionStore implements SessionStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileSessionStore.class);

    private final Path directory;
    private final Clock clock;

    public JsonFileSessionStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public Path directory() {
        return directory;
    }

    static String fileName(TranscriptSession session) {
        return "session_" + session.startTime().toString().replace(':', '-').replace('.', '-') + ".json";
    }

    @Override
    public Path save(TranscriptSession session, SessionSummary summary) {
        Path target = directory.resolve(fileName(session));
        String json = TranscriptJson.toJson(session, summary, clock.instant()).toString(2);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, "session_", ".tmp");
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Session {} saved to {} ({} transcripts)", session.id(), target, session.transcripts().size());
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException(target.toString(), e);
        }
    }

    @Override
    public TranscriptSession load(Path path) {
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            return TranscriptJson.sessionFrom(new JSONObject(json));
        } catch (IOException | JSONException | IllegalArgumentException e) {
            throw new PersistenceException(path.toString(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary session file {}: {}", tmp, e.getMessage());
        }
    }
}
