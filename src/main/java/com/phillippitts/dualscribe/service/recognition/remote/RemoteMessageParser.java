package com.phillippitts.dualscribe.service.recognition.remote;

import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Codec for the remote recognizer's JSON text messages.
 *
 * <p>Downstream: {@code {"type":"interim","text":"...","timestamp":123}},
 * {@code {"type":"final","text":"...","confidence":0.92,"timestamp":123}},
 * {@code {"type":"error","kind":"auth|connectivity|protocol","message":"..."}}.
 * Upstream control: {@code {"type":"end"}}. Audio travels as binary frames.
 */
final class RemoteMessageParser {

    static final String END_OF_STREAM = new JSONObject().put("type", "end").toString();

    private RemoteMessageParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Decodes one message. Unknown types decode to {@link RemoteMessage.Type#IGNORED}; malformed JSON
     * decodes to a PROTOCOL error.
     */
    static RemoteMessage parse(String json) {
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            return new RemoteMessage(RemoteMessage.Type.ERROR, "", 0.0, -1L, RecognitionErrorKind.PROTOCOL,
                    "Malformed recognizer message");
        }
        String type = obj.optString("type", "").toLowerCase(Locale.ROOT);
        long ts = obj.optLong("timestamp", -1L);
        return switch (type) {
            case "interim", "partial" -> new RemoteMessage(RemoteMessage.Type.INTERIM,
                    obj.optString("text", ""), 0.0, ts, null, null);
            case "final" -> new RemoteMessage(RemoteMessage.Type.FINAL,
                    obj.optString("text", ""), obj.optDouble("confidence", 1.0), ts, null, null);
            case "error" -> new RemoteMessage(RemoteMessage.Type.ERROR, "", 0.0, ts,
                    errorKind(obj.optString("kind", "")), obj.optString("message", "recognizer error"));
            default -> RemoteMessage.ignored();
        };
    }

    static RecognitionErrorKind errorKind(String kind) {
        return switch (kind.toLowerCase(Locale.ROOT)) {
            case "auth", "authentication", "unauthorized" -> RecognitionErrorKind.AUTHENTICATION;
            case "connectivity", "network", "timeout" -> RecognitionErrorKind.CONNECTIVITY;
            default -> RecognitionErrorKind.PROTOCOL;
        };
    }
}
