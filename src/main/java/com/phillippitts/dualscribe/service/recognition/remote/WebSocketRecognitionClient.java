package com.phillippitts.dualscribe.service.recognition.remote;

import com.phillippitts.dualscribe.domain.StreamId;
import com.phillippitts.dualscribe.exception.AuthenticationException;
import com.phillippitts.dualscribe.exception.ConnectivityException;
import com.phillippitts.dualscribe.exception.RecognitionException;
import com.phillippitts.dualscribe.service.recognition.LanguageConfig;
import com.phillippitts.dualscribe.service.recognition.RecognitionClient;
import com.phillippitts.dualscribe.service.recognition.RecognitionErrorKind;
import com.phillippitts.dualscribe.service.recognition.RecognitionHandle;
import com.phillippitts.dualscribe.service.recognition.RecognitionListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Remote streaming recognizer reached over a WebSocket.
 *
 * <p>The stream, language and interim flag travel as query parameters; the API key is sent as a
 * bearer token. A 401 or 403 handshake response maps to {@link AuthenticationException}, every
 * other connection failure to {@link ConnectivityException}. An abnormal close while streaming is
 * reported to the listener as a CONNECTIVITY error.
 */
public class WebSocketRecognitionClient implements RecognitionClient {

    private static final Logger LOG = LogManager.getLogger(WebSocketRecognitionClient.class);

    private final URI endpoint;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Clock clock;

    public WebSocketRecognitionClient(URI endpoint, String apiKey, HttpClient httpClient,
                                      Duration connectTimeout, Clock clock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.apiKey = apiKey;
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<RecognitionHandle> open(StreamId streamId, LanguageConfig language,
                                                     RecognitionListener listener) {
        SocketListener socketListener = new SocketListener(streamId, listener);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.buildAsync(sessionUri(streamId, language), socketListener)
                .<RecognitionHandle>handle((ws, error) -> {
                    if (error != null) {
                        throw translate(streamId, error);
                    }
                    LOG.debug("Remote recognizer connected for {}", streamId.wireName());
                    return new SocketHandle(ws, socketListener);
                });
    }

    // Package-private for tests
    URI sessionUri(StreamId streamId, LanguageConfig language) {
        String query = "stream=" + streamId.wireName()
                + "&language=" + URLEncoder.encode(language.language(), StandardCharsets.UTF_8)
                + "&interim=" + language.interimResults();
        String base = endpoint.toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    // Package-private for tests
    static RecognitionException translate(StreamId streamId, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WebSocketHandshakeException handshake) {
            int status = handshake.getResponse().statusCode();
            if (status == 401 || status == 403) {
                return new AuthenticationException("Remote recognizer rejected credentials (HTTP " + status + ")",
                        streamId, handshake);
            }
            return new ConnectivityException("Remote recognizer handshake failed (HTTP " + status + ")",
                    streamId, handshake);
        }
        if (cause instanceof RecognitionException re) {
            return re;
        }
        return new ConnectivityException("Remote recognizer unreachable: " + cause, streamId, cause);
    }

    /** Upstream side: binary audio frames chained so at most one send is outstanding. */
    private static final class SocketHandle implements RecognitionHandle {

        private final WebSocket socket;
        private final SocketListener socketListener;
        private CompletableFuture<WebSocket> lastSend;

        SocketHandle(WebSocket socket, SocketListener socketListener) {
            this.socket = socket;
            this.socketListener = socketListener;
            this.lastSend = CompletableFuture.completedFuture(socket);
        }

        @Override
        public synchronized void send(byte[] pcm) {
            if (socket.isOutputClosed()) {
                throw new ConnectivityException("Remote recognizer connection is closed", socketListener.streamId);
            }
            lastSend = lastSend.thenCompose(ws -> ws.sendBinary(ByteBuffer.wrap(pcm), true));
        }

        @Override
        public synchronized CompletableFuture<Void> close() {
            if (socketListener.closing) {
                return socketListener.closed;
            }
            socketListener.closing = true;
            if (socket.isOutputClosed()) {
                socketListener.closed.complete(null);
                return socketListener.closed;
            }
            // The server flushes its final results and then closes the socket
            lastSend.thenCompose(ws -> ws.sendText(RemoteMessageParser.END_OF_STREAM, true))
                    .whenComplete((ws, error) -> {
                        if (error != null) {
                            LOG.debug("Sending end-of-stream for {} failed: {}",
                                    socketListener.streamId.wireName(), error.toString());
                            socket.abort();
                            socketListener.closed.complete(null);
                        }
                    });
            return socketListener.closed;
        }
    }

    /** Downstream side: reassembles text messages and forwards them to the recognition listener. */
    private final class SocketListener implements WebSocket.Listener {

        private final StreamId streamId;
        private final RecognitionListener listener;
        private final StringBuilder partialText = new StringBuilder();
        private final CompletableFuture<Void> closed = new CompletableFuture<>();
        private volatile boolean closing;

        SocketListener(StreamId streamId, RecognitionListener listener) {
            this.streamId = streamId;
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partialText.append(data);
            if (last) {
                String json = partialText.toString();
                partialText.setLength(0);
                dispatch(RemoteMessageParser.parse(json));
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (!closing && statusCode != WebSocket.NORMAL_CLOSURE) {
                listener.onError(RecognitionErrorKind.CONNECTIVITY,
                        "Remote recognizer closed the connection (" + statusCode + ")");
            }
            closed.complete(null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            if (!closing) {
                listener.onError(RecognitionErrorKind.CONNECTIVITY, "Remote recognizer connection failed: " + error);
            }
            closed.complete(null);
        }

        private void dispatch(RemoteMessage msg) {
            long ts = msg.timestampMs() >= 0 ? msg.timestampMs() : clock.millis();
            switch (msg.type()) {
                case INTERIM -> {
                    if (!msg.text().isBlank()) {
                        listener.onInterim(msg.text(), ts);
                    }
                }
                case FINAL -> listener.onFinal(msg.text(), msg.confidence(), ts);
                case ERROR -> listener.onError(msg.errorKind(), msg.message());
                case IGNORED -> LOG.debug("Ignoring unknown recognizer message for {}", streamId.wireName());
                default -> throw new IllegalStateException("Unhandled message type " + msg.type());
            }
        }
    }
}
