package com.phillippitts.dualscribe.service.transcript;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically persists the active session while {@code transcript.auto-save} is enabled.
 *
 * <p>Sessions with no transcripts yet are skipped. Failures are reported by the engine as events,
 * so a failed tick never stops later ones.
 */
public class SessionAutoSaver {

    private static final Logger LOG = LogManager.getLogger(SessionAutoSaver.class);

    private final TranscriptEngine engine;
    private final boolean enabled;

    public SessionAutoSaver(TranscriptEngine engine, boolean enabled) {
        this.engine = engine;
        this.enabled = enabled;
        LOG.info("Session auto-save {}", enabled ? "enabled" : "disabled");
    }

    @Scheduled(fixedDelayString = "${transcript.auto-save-interval-ms:30000}",
            initialDelayString = "${transcript.auto-save-interval-ms:30000}")
    public void autoSave() {
        if (!enabled) {
            return;
        }
        engine.saveSnapshot().ifPresent(path -> LOG.debug("Auto-saved active session to {}", path));
    }
}
