package com.phillippitts.dualscribe.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void usesAndEchoesRequestIdHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-42");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/recording/start");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-42");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/recording/start");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "req-42");
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidWhenHeaderMissing() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(" ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/transcripts");

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Request-ID"),
                matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }

    @Test
    void addsClientIdWhenPresent() throws ServletException, IOException {
        when(request.getHeader("X-Client-ID")).thenReturn(" overlay-ui ");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("client")).isEqualTo("overlay-ui");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void tagsAudioUploadsWithTheirStream() throws ServletException, IOException {
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/audio/SYSTEM_AUDIO");
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("stream")).isEqualTo("system");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        assertThat(ThreadContext.get("stream")).isNull();
    }

    @Test
    void leavesStreamUnsetOutsideAudioUploads() {
        assertThat(MdcFilter.uploadStream("/api/audio/devices")).isNull();
        assertThat(MdcFilter.uploadStream("/api/recording/start")).isNull();
        assertThat(MdcFilter.uploadStream("/api/audio/")).isNull();
        assertThat(MdcFilter.uploadStream("/api/audio/microphone")).isEqualTo("microphone");
    }

    @Test
    void clearsContextWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        doThrow(new ServletException("boom")).when(chain).doFilter(any(), any());

        assertThatThrownBy(() -> filter.doFilter(request, response, chain)).isInstanceOf(ServletException.class);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
