package com.phillippitts.dualscribe.service.transcript;

import com.phillippitts.dualscribe.domain.Transcript;
import com.phillippitts.dualscribe.util.TimeUtils;
import org.json.JSONArray;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders transcript lists as JSON, plain text, CSV or SubRip subtitles.
 *
 * <p>Stateless apart from the zone used for wall-clock rendering; safe for concurrent use.
 */
public class TranscriptExporter {

    static final String CSV_HEADER = "Timestamp,Speaker,Text,Confidence";

    private final DateTimeFormatter textClock;
    private final long subtitleDefaultDurationMs;
    private final boolean speakerTagging;

    /**
     * @param clock                     supplies the zone for {@code [HH:mm:ss]} text stamps
     * @param subtitleDefaultDurationMs display time of the last subtitle cue
     * @param speakerTagging            prefix text and subtitle lines with {@code [Speaker]}
     */
    public TranscriptExporter(Clock clock, long subtitleDefaultDurationMs, boolean speakerTagging) {
        if (subtitleDefaultDurationMs <= 0) {
            throw new IllegalArgumentException("subtitleDefaultDurationMs must be > 0");
        }
        ZoneId zone = clock.getZone();
        this.textClock = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
        this.subtitleDefaultDurationMs = subtitleDefaultDurationMs;
        this.speakerTagging = speakerTagging;
    }

    /**
     * @param format      output format
     * @param transcripts entries in log order
     * @param originMs    epoch millis that subtitle times are relative to (normally the session start)
     */
    public String export(ExportFormat format, List<Transcript> transcripts, long originMs) {
        return switch (format) {
            case JSON -> toJson(transcripts);
            case TEXT -> toText(transcripts);
            case CSV -> toCsv(transcripts);
            case SUBTITLE -> toSubtitles(transcripts, originMs);
        };
    }

    String toJson(List<Transcript> transcripts) {
        return TranscriptJson.toJson(transcripts).toString(2);
    }

    /** Parses output of the JSON export back into transcripts. */
    public List<Transcript> parseJson(String json) {
        return TranscriptJson.transcriptsFrom(new JSONArray(json));
    }

    String toText(List<Transcript> transcripts) {
        StringBuilder sb = new StringBuilder();
        for (Transcript t : transcripts) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append('[').append(textClock.format(Instant.ofEpochMilli(t.timestampMs()))).append("] ")
                    .append(line(t));
        }
        return sb.toString();
    }

    String toCsv(List<Transcript> transcripts) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (Transcript t : transcripts) {
            sb.append(quote(Instant.ofEpochMilli(t.timestampMs()).toString())).append(',')
                    .append(quote(t.speaker())).append(',')
                    .append(quote(t.text())).append(',')
                    .append(quote(Double.toString(t.confidence())))
                    .append('\n');
        }
        return sb.toString();
    }

    String toSubtitles(List<Transcript> transcripts, long originMs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < transcripts.size(); i++) {
            Transcript t = transcripts.get(i);
            long start = t.timestampMs() - originMs;
            long end = i < transcripts.size() - 1
                    ? transcripts.get(i + 1).timestampMs() - originMs
                    : start + subtitleDefaultDurationMs;
            end = Math.max(end, start);
            sb.append(i + 1).append('\n')
                    .append(TimeUtils.formatSubtitleClock(start)).append(" --> ")
                    .append(TimeUtils.formatSubtitleClock(end)).append('\n')
                    .append(line(t)).append("\n\n");
        }
        return sb.toString();
    }

    private String line(Transcript t) {
        return speakerTagging ? t.taggedText() : t.text();
    }

    private static String quote(String value) {
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
