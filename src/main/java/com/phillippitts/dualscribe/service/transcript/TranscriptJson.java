package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.SessionSummary;
import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.domain.TranscriptKind;
import com.phillippitts.dualscribe.domain.TranscriptSession;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * org.json mapping of transcript domain records. Shared by the exporter and the session store.
 */
final class TranscriptJson {

    private TranscriptJson() {
        // Utility class - prevent instantiation
    }

    static JSONObject toJson(Transcript t) {
        JSONObject o = new JSONObject();
        o.put("id", t.id());
        o.put("sessionId", t.sessionId() == null ? JSONObject.NULL : t.sessionId());
        o.put("streamId", t.streamId().wireName());
        o.put("speaker", t.speaker());
        o.put("text", t.text());
        o.put("taggedText", t.taggedText());
        o.put("confidence", t.confidence());
        o.put("timestamp", t.timestampMs());
        o.put("kind", t.kind().name().toLowerCase(Locale.ROOT));
        return o;
    }

    static JSONArray toJson(List<Transcript> transcripts) {
        JSONArray arr = new JSONArray();
        for (Transcript t : transcripts) {
            arr.put(toJson(t));
        }
        return arr;
    }

    /**
     * Reads a transcript written by {@link #toJson(Transcript)}.
     *
     * @throws JSONException when a required field is missing or malformed
     */
    static Transcript transcriptFrom(JSONObject o) {
        String sessionId = o.isNull("sessionId") ? null : o.optString("sessionId", null);
        StreamId stream = StreamId.fromWire(o.getString("streamId"));
        TranscriptKind kind = TranscriptKind.valueOf(o.optString("kind", "final").toUpperCase(Locale.ROOT));
        return new Transcript(o.getString("id"), sessionId, stream, o.getString("speaker"),
                o.getString("text"), o.getDouble("confidence"), o.getLong("timestamp"), kind);
    }

    static List<Transcript> transcriptsFrom(JSONArray arr) {
        List<Transcript> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(transcriptFrom(arr.getJSONObject(i)));
        }
        return out;
    }

    static JSONObject toJson(SessionSummary s) {
        JSONObject o = new JSONObject();
        o.put("sessionId", s.sessionId());
        o.put("totalTranscripts", s.totalTranscripts());
        o.put("wordCount", s.wordCount());
        o.put("averageConfidence", s.averageConfidence());
        o.put("durationMs", s.duration().toMillis());
        JSONArray speakers = new JSONArray();
        for (SessionSummary.SpeakerStats st : s.speakers()) {
            speakers.put(new JSONObject()
                    .put("speaker", st.speaker())
                    .put("transcriptCount", st.transcriptCount())
                    .put("wordCount", st.wordCount()));
        }
        o.put("speakers", speakers);
        return o;
    }

    /**
     * Full session document: {@code {id, startTime, endTime, metadata, transcripts, summary, exportedAt}}.
     */
    static JSONObject toJson(TranscriptSession session, SessionSummary summary, Instant exportedAt) {
        JSONObject o = new JSONObject();
        o.put("id", session.id());
        o.put("startTime", session.startTime().toEpochMilli());
        o.put("endTime", session.endTime() == null ? JSONObject.NULL : session.endTime().toEpochMilli());
        o.put("metadata", new JSONObject(session.metadata()));
        o.put("transcripts", toJson(session.transcripts()));
        o.put("summary", toJson(summary));
        o.put("exportedAt", exportedAt.toEpochMilli());
        return o;
    }

    static TranscriptSession sessionFrom(JSONObject o) {
        Instant start = Instant.ofEpochMilli(o.getLong("startTime"));
        Instant end = o.isNull("endTime") ? null : Instant.ofEpochMilli(o.getLong("endTime"));
        JSONObject meta = o.optJSONObject("metadata");
        Map<String, String> metadata = new LinkedHashMap<>();
        if (meta != null) {
            for (String key : meta.keySet()) {
                metadata.put(key, String.valueOf(meta.get(key)));
            }
        }
        List<Transcript> transcripts = transcriptsFrom(o.optJSONArray("transcripts") == null
                ? new JSONArray() : o.getJSONArray("transcripts"));
        return new TranscriptSession(o.getString("id"), start, end, transcripts, metadata);
    }
}
