package com.phillippitts.slawatch.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

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

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

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
    void echoesRequestIdFromHeader() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/response-times");

        filter.doFilter(request, response, chain);

        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "test-request-123");
        verify(chain).doFilter(request, response);
        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void generatesUuidIfRequestIdHeaderMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/response-times/averages");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), matches(UUID_PATTERN));
    }

    @Test
    void setsAllValuesInSingleRequest() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-xyz");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("user-abc");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/telemetry/resync");

        doAnswer(invocation -> {
            Map<String, String> contextMap = ThreadContext.getContext();
            assertThat(contextMap).containsEntry("requestId", "req-xyz");
            assertThat(contextMap).containsEntry("userId", "user-abc");
            assertThat(contextMap).containsEntry("method", "POST");
            assertThat(contextMap).containsEntry("uri", "/api/telemetry/resync");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void doesNotSetUserIdIfHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");
        when(request.getHeader(MdcFilter.USER_ID_HEADER)).thenReturn("  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/telemetry/health");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("userId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/response-times");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
