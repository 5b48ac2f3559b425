package com.phillippitts.dualscribe.config.logging;

import com.phillippitts.dualscribe.domain.StreamId;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every API request's log lines with recording context in Log4j2's ThreadContext.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed back in the response</li>
 *   <li>client: from X-Client-ID header, naming the UI or feeder process driving the recorder</li>
 *   <li>stream: wire name of the audio stream for {@code /api/audio/{source}} uploads</li>
 *   <li>method and uri</li>
 * </ul>
 *
 * <p>The context is always cleared after the request; worker threads get their own copy.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";
    private static final String AUDIO_PREFIX = "/api/audio/";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String client = http.getHeader(CLIENT_ID_HEADER);
                if (client != null && !client.isBlank()) {
                    ThreadContext.put("client", client.trim());
                }

                String uri = http.getRequestURI();
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", uri);
                String stream = uploadStream(uri);
                if (stream != null) {
                    ThreadContext.put("stream", stream);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** Wire name of the stream an audio upload targets, or {@code null} for other paths and unknown sources. */
    static String uploadStream(String uri) {
        if (uri == null || !uri.startsWith(AUDIO_PREFIX)) {
            return null;
        }
        String segment = uri.substring(AUDIO_PREFIX.length());
        if (segment.isEmpty() || segment.contains("/")) {
            return null;
        }
        try {
            return StreamId.fromWire(segment).wireName();
        } catch (IllegalArgumentException e) {
            // the controller rejects the path; log it untagged
            return null;
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
