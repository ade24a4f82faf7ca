package org.example.dailyreport.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void doFilter_propagatesRequestIdAndClientIpToMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/reports");
        request.addHeader("X-Request-Id", "  abc-123  ");
        request.addHeader("X-Forwarded-For", "1.2.3.4, 10.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenClientIp = new AtomicReference<>();
        FilterChain chain = (req, res) -> {
            seenRequestId.set(MDC.get("requestId"));
            seenClientIp.set(MDC.get("clientIp"));
        };

        filter.doFilter(request, response, chain);

        assertEquals("abc-123", seenRequestId.get());
        assertEquals("1.2.3.4", seenClientIp.get());
        assertEquals("abc-123", response.getHeader("X-Request-Id"));
        assertEquals("abc-123", RequestCorrelation.resolveRequestId(request));
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("clientIp"));
    }

    @Test
    void doFilter_generatesRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertNotNull(response.getHeader("X-Request-Id"));
        assertEquals(36, response.getHeader("X-Request-Id").length());
    }

    @Test
    void normalizeRequestId_truncatesLongValues() {
        String longId = "x".repeat(120);

        assertEquals(80, RequestCorrelation.normalizeRequestId(longId).length());
        assertNull(RequestCorrelation.normalizeRequestId("   "));
        assertEquals("unknown", RequestCorrelation.resolveRequestId(null));
    }
}
