package com.di.schemanova.config;

import jakarta.servlet.ServletException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for MdcRequestFilter.
 */
@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    private final MdcRequestFilter filter = new MdcRequestFilter();

    private Map<String, String> runFilter(MockHttpServletRequest request, MockHttpServletResponse response)
            throws ServletException, IOException {
        Map<String, String> seen = new HashMap<>();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.putAll(MDC.getCopyOfContextMap());
            }
        };
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    @DisplayName("Should reuse and echo an incoming request id")
    void testFilter_IncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/schema/analyze");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "  abc-123 ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = runFilter(request, response);

        assertEquals("abc-123", seen.get("requestId"));
        assertEquals("/api/schema/analyze", seen.get("requestPath"));
        assertEquals("abc-123", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("Should generate a request id when none is sent and clear MDC afterwards")
    void testFilter_GeneratedRequestId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = runFilter(new MockHttpServletRequest("GET", "/api/schema/runs"), response);

        assertTrue(seen.get("requestId").startsWith("req-"));
        assertEquals(seen.get("requestId"), response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("requestPath"));
    }
}
