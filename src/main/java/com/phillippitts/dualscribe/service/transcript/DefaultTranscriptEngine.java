package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.InterimTranscript;
import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.domain.TranscriptSession;
import com.phillippitts.dualscribe.exception.PersistenceException;
import com.phillippitts.dualscribe.service.metrics.RecordingMetrics;
import com.phillippitts.dualscribe.service.transcript.event.FinalTranscriptEvent;
import com.phillippitts.dualscribe.service.transcript.event.InterimTranscriptEvent;
import com.phillippitts.dualscribe.service.transcript.event.PersistenceFailedEvent;
import com.phillippitts.dualscribe.service.transcript.event.SessionEndedEvent;
import com.phillippitts.dualscribe.service.transcript.event.SessionSavedEvent;
import com.phillippitts.dualscribe.service.transcript.event.SessionStartedEvent;
import com.phillippitts.dualscribe.service.transcript.event.TranscriptRetractedEvent;
import com.phillippitts.dualscribe.service.transcript.event.TranscriptUpdatedEvent;
import com.phillippitts.dualscribe.service.transcript.event.TranscriptsClearedEvent;
import com.phillippitts.dualscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link TranscriptEngine} backed by a {@link TranscriptLog} and a {@link DuplicateSuppressor}.
 *
 * <p><b>Thread Safety:</b> all state is guarded by one {@link ReentrantLock}. Events are collected
 * while the lock is held and published after it is released, in the order they were raised.
 * File writes also happen outside the lock.
 *
 * <p>After {@link #endSession()} the log keeps the sealed session's transcripts (for queries and
 * export) until the next {@link #startSession(Map)}. Finals arriving while no session is active
 * are discarded.
 */
public class DefaultTranscriptEngine implements TranscriptEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptEngine.class);

    private final Lock lock = new ReentrantLock();
    private final TranscriptLog log;
    private final Map<StreamId, InterimTranscript> interim = new EnumMap<>(StreamId.class);
    private final DuplicateSuppressor suppressor;
    private final SessionStore store;
    private final TranscriptExporter exporter;
    private final ApplicationEventPublisher publisher;
    private final RecordingMetrics metrics;
    private final Clock clock;
    private final int updatedWindow;
    private final AtomicLong transcriptSeq = new AtomicLong();

    private volatile DuplicatePolicy policy;
    private TranscriptSession session;
    private boolean sessionActive;

    /**
     * @param maxBufferSize  upper bound of the log
     * @param updatedWindow  entries carried by each {@link TranscriptUpdatedEvent}
     * @param policy         initial duplicate policy
     * @param suppressor     duplicate decision logic
     * @param store          session persistence, or {@code null} to keep sessions in memory only
     * @param exporter       export renderer
     * @param publisher      event sink
     * @param metrics        metrics sink, or {@code null} for none
     * @param clock          time source for session start/end
     */
    public DefaultTranscriptEngine(int maxBufferSize,
                                   int updatedWindow,
                                   DuplicatePolicy policy,
                                   DuplicateSuppressor suppressor,
                                   SessionStore store,
                                   TranscriptExporter exporter,
                                   ApplicationEventPublisher publisher,
                                   RecordingMetrics metrics,
                                   Clock clock) {
        this.log = new TranscriptLog(maxBufferSize);
        this.updatedWindow = Math.max(1, updatedWindow);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.suppressor = Objects.requireNonNull(suppressor, "suppressor");
        this.store = store;
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? RecordingMetrics.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String startSession(Map<String, String> metadata) {
        List<Object> events = new ArrayList<>(2);
        TranscriptSession sealed = null;
        SessionSummary sealedSummary = null;
        String id;
        lock.lock();
        try {
            if (sessionActive) {
                sealed = sealLocked();
                sealedSummary = summarize(sealed);
            }
            Instant start = clock.instant();
            id = "session_" + start.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
            session = new TranscriptSession(id, start, null, List.of(), metadata);
            sessionActive = true;
            log.clear();
            interim.clear();
            events.add(new SessionStartedEvent(id, start));
        } finally {
            lock.unlock();
        }
        if (sealed != null) {
            LOG.info("Session {} sealed implicitly by new session start", sealed.id());
            publisher.publishEvent(new SessionEndedEvent(sealedSummary, persist(sealed, sealedSummary, true)));
        }
        LOG.info("Transcript session {} started", id);
        events.forEach(publisher::publishEvent);
        return id;
    }

    @Override
    public Optional<SessionSummary> endSession() {
        TranscriptSession sealed;
        SessionSummary summary;
        lock.lock();
        try {
            if (!sessionActive) {
                LOG.debug("endSession ignored: no active session");
                return Optional.empty();
            }
            sealed = sealLocked();
            summary = summarize(sealed);
        } finally {
            lock.unlock();
        }
        Path savedTo = persist(sealed, summary, true);
        LOG.info("Transcript session {} ended: {} transcripts, {} words", sealed.id(),
                summary.totalTranscripts(), summary.wordCount());
        publisher.publishEvent(new SessionEndedEvent(summary, savedTo));
        return Optional.of(summary);
    }

    private TranscriptSession sealLocked() {
        session = session.seal(clock.instant(), log.snapshot());
        sessionActive = false;
        interim.clear();
        return session;
    }

    private static SessionSummary summarize(TranscriptSession s) {
        return SessionSummary.of(s.id(), s.startTime(), s.endTime(), s.transcripts());
    }

    @Override
    public void addInterim(StreamId streamId, String text, long timestampMs) {
        if (streamId == null || text == null || text.isBlank()) {
            LOG.debug("Ignoring empty interim for {}", streamId);
            return;
        }
        InterimTranscript it = InterimTranscript.of(streamId, text.trim(), timestampMs);
        lock.lock();
        try {
            if (!sessionActive) {
                LOG.debug("Ignoring interim for {}: no active session", streamId);
                return;
            }
            interim.put(streamId, it);
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new InterimTranscriptEvent(streamId, it.speaker(), it.text(), timestampMs));
    }

    @Override
    public Optional<Transcript> addFinal(StreamId streamId, String text, double confidence, long timestampMs) {
        if (streamId == null || text == null || text.isBlank()) {
            LOG.debug("Ignoring empty final for {}", streamId);
            return Optional.empty();
        }
        double conf = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        List<Object> events = new ArrayList<>(3);
        Transcript candidate;
        lock.lock();
        try {
            if (!sessionActive) {
                LOG.info("Discarding final from {} received with no active session: '{}'",
                        streamId, LogSanitizer.preview(text));
                return Optional.empty();
            }
            candidate = Transcript.finalOf("transcript_" + transcriptSeq.incrementAndGet(), session.id(),
                    streamId, text, conf, timestampMs);
            interim.remove(streamId);

            DuplicatePolicy p = policy;
            Transcript latestPreferred = p.preferred().flatMap(log::latestFrom).orElse(null);
            SuppressionDecision decision = suppressor.evaluate(candidate,
                    log.recentNewestFirst(p.comparisonDepth()), latestPreferred, p);
            switch (decision.action()) {
                case SUPPRESS -> {
                    metrics.incrementSuppressed(decision.reason());
                    LOG.debug("Suppressed {} final '{}' ({}, matched {})", candidate.speaker(),
                            LogSanitizer.preview(candidate.text()), decision.reason(), decision.matchedId());
                    return Optional.empty();
                }
                case REPLACE -> {
                    for (String replacedId : decision.replacedIds()) {
                        if (log.remove(replacedId).isPresent()) {
                            metrics.incrementReplaced();
                            events.add(new TranscriptRetractedEvent(replacedId, candidate.id(), clock.instant()));
                            LOG.debug("Replacing {} with preferred-source final {}", replacedId, candidate.id());
                        }
                    }
                }
                case ACCEPT -> {
                    // stored below
                }
            }
            for (Transcript evicted : log.append(candidate)) {
                LOG.debug("Evicted oldest transcript {} (buffer full)", evicted.id());
            }
            metrics.incrementFinalAccepted(candidate.speaker());
            events.add(new FinalTranscriptEvent(candidate));
            events.add(new TranscriptUpdatedEvent(log.recent(updatedWindow), log.size()));
        } finally {
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
        return Optional.of(candidate);
    }

    @Override
    public List<Transcript> getRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            return log.recent(n);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Transcript> search(String query, SearchOptions options) {
        SearchOptions opts = options == null ? SearchOptions.defaults() : options;
        String q = query == null ? "" : query;
        String needle = opts.caseSensitive() ? q : q.toLowerCase(Locale.ROOT);
        List<Transcript> all;
        lock.lock();
        try {
            all = log.snapshot();
        } finally {
            lock.unlock();
        }
        List<Transcript> matches = new ArrayList<>();
        for (Transcript t : all) {
            if (opts.speaker() != null && !opts.speaker().equals(t.speaker())) {
                continue;
            }
            if (opts.fromMs() != null && t.timestampMs() < opts.fromMs()) {
                continue;
            }
            if (opts.toMs() != null && t.timestampMs() > opts.toMs()) {
                continue;
            }
            String hay = opts.caseSensitive() ? t.text() : t.text().toLowerCase(Locale.ROOT);
            if (hay.contains(needle)) {
                matches.add(t);
            }
        }
        int from = Math.max(0, matches.size() - opts.limit());
        return List.copyOf(matches.subList(from, matches.size()));
    }

    @Override
    public String export(ExportFormat format) {
        List<Transcript> snapshot;
        long origin;
        lock.lock();
        try {
            snapshot = log.snapshot();
            if (session != null) {
                origin = session.startTime().toEpochMilli();
            } else {
                origin = snapshot.isEmpty() ? 0L : snapshot.get(0).timestampMs();
            }
        } finally {
            lock.unlock();
        }
        return exporter.export(format, snapshot, origin);
    }

    @Override
    public List<InterimTranscript> getInterimTranscripts() {
        lock.lock();
        try {
            return List.copyOf(interim.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Transcript> getSessionTranscripts() {
        lock.lock();
        try {
            if (session == null) {
                return List.of();
            }
            return sessionActive ? log.snapshot() : session.transcripts();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TranscriptSession> currentSession() {
        lock.lock();
        try {
            if (!sessionActive) {
                return Optional.empty();
            }
            return Optional.of(session.withTranscripts(log.snapshot()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TranscriptStatus getStatus() {
        lock.lock();
        try {
            return new TranscriptStatus(session == null ? null : session.id(), sessionActive,
                    session == null ? null : session.startTime(), log.size(), interim.size(), policy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DuplicatePolicy getPolicy() {
        return policy;
    }

    @Override
    public void updatePolicy(DuplicatePolicy newPolicy) {
        this.policy = Objects.requireNonNull(newPolicy, "policy");
        LOG.info("Duplicate policy updated: filter={}, preferred={}, threshold={}, windowMs={}",
                newPolicy.filterDuplicates(), newPolicy.preferredSource(),
                newPolicy.similarityThreshold(), newPolicy.timeWindowMs());
    }

    @Override
    public void clearTranscripts() {
        String sessionId;
        lock.lock();
        try {
            log.clear();
            interim.clear();
            sessionId = session == null ? null : session.id();
        } finally {
            lock.unlock();
        }
        LOG.info("Transcripts cleared");
        publisher.publishEvent(new TranscriptsClearedEvent(sessionId, clock.instant()));
    }

    @Override
    public Optional<Path> saveSnapshot() {
        TranscriptSession snapshot;
        lock.lock();
        try {
            if (!sessionActive || log.size() == 0) {
                return Optional.empty();
            }
            snapshot = session.withTranscripts(log.snapshot());
        } finally {
            lock.unlock();
        }
        SessionSummary summary = SessionSummary.of(snapshot.id(), snapshot.startTime(), clock.instant(),
                snapshot.transcripts());
        return Optional.ofNullable(persist(snapshot, summary, false));
    }

    /**
     * Writes a snapshot; failures are reported as {@link PersistenceFailedEvent} and never thrown.
     *
     * @return path written, or {@code null} when there is no store or the write failed
     */
    private Path persist(TranscriptSession s, SessionSummary summary, boolean sealed) {
        if (store == null) {
            return null;
        }
        try {
            Path path = store.save(s, summary);
            publisher.publishEvent(new SessionSavedEvent(s.id(), path, sealed, clock.instant()));
            return path;
        } catch (PersistenceException e) {
            LOG.warn("Failed to save session {}: {}", s.id(), e.getMessage());
            publisher.publishEvent(new PersistenceFailedEvent(s.id(), Path.of(e.getPath()),
                    String.valueOf(e.getCause()), clock.instant()));
            return null;
        }
    }
}
