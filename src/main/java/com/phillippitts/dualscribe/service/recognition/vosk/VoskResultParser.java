package com.phillippitts.dualscribe.service.recognition.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Utility to parse Vosk JSON output into text and confidence scores.
 *
 * <p>This parser handles the Vosk streaming response formats:
 * <ul>
 *   <li><b>Final result format:</b> {@code {"text": "...", "result": [{"word": "...", "conf": 0.9}, ...]}}</li>
 *   <li><b>Alternatives format:</b> {@code {"alternatives": [{"text": "...", "confidence": ...}]}}</li>
 *   <li><b>Partial format:</b> {@code {"partial": "..."}}</li>
 * </ul>
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p><b>Security:</b> caps JSON response size at {@link #MAX_JSON_SIZE} (1MB).
 *
 * @since 1.0
 */
final class VoskResultParser {

    private static final Logger LOG = LogManager.getLogger(VoskResultParser.class);

    /**
     * Maximum allowed JSON response size from Vosk recognizer (1MB).
     */
    private static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private VoskResultParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a final (endpointed) Vosk result.
     *
     * @param json JSON string from {@code getResult()} or {@code getFinalResult()}
     * @return parsed text (possibly empty) and confidence in [0, 1]
     */
    static VoskResult parse(String json) {
        if (json == null || json.isBlank()) {
            return new VoskResult("", 1.0);
        }
        json = truncateJsonIfNeeded(json);
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                if (alternatives.isEmpty()) {
                    return new VoskResult("", 1.0);
                }
                JSONObject firstAlt = alternatives.getJSONObject(0);
                // Vosk alternatives may report unnormalized scores above 1.0
                return new VoskResult(firstAlt.optString("text", "").trim(),
                        clamp(firstAlt.optDouble("confidence", 1.0)));
            }
            return new VoskResult(obj.optString("text", "").trim(), extractConfidence(obj));
        } catch (Exception e) {
            LOG.warn("Failed to parse Vosk JSON response (length={})", json.length(), e);
            return new VoskResult("", 1.0);
        }
    }

    /**
     * Extracts the running hypothesis from a partial result.
     *
     * @return partial text, or "" when absent or malformed
     */
    static String parsePartial(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        try {
            return new JSONObject(truncateJsonIfNeeded(json)).optString("partial", "").trim();
        } catch (Exception e) {
            LOG.debug("Failed to parse Vosk partial result: {}", e.toString());
            return "";
        }
    }

    private static String truncateJsonIfNeeded(String json) {
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating",
                    MAX_JSON_SIZE, json.length());
            return json.substring(0, MAX_JSON_SIZE);
        }
        return json;
    }

    /**
     * Average of per-word {@code conf} values, or 1.0 when no word confidences are present.
     */
    private static double extractConfidence(JSONObject obj) {
        JSONArray results = obj.optJSONArray("result");
        if (results == null || results.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < results.length(); i++) {
            JSONObject wordObj = results.getJSONObject(i);
            if (wordObj.has("conf")) {
                sum += wordObj.getDouble("conf");
                count++;
            }
        }
        return count > 0 ? clamp(sum / count) : 1.0;
    }

    private static double clamp(double v) {
        return Math.min(1.0, Math.max(0.0, v));
    }

    /**
     * Parsed Vosk result.
     *
     * @param text recognized text (may be empty)
     * @param confidence confidence score (0.0-1.0)
     */
    record VoskResult(String text, double confidence) {
    }
}
