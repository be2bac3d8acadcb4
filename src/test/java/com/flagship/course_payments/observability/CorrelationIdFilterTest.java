package com.flagship.course_payments.observability;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("Incoming correlation id is used for the request and echoed back")
    void keepsIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/payments/verify");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInMdc.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                MDC.put(CorrelationContext.INTENT_ID_MDC_KEY, "intent");
            }
        });

        assertEquals("abc-123", seenInMdc.get());
        assertEquals("abc-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.INTENT_ID_MDC_KEY));
        assertFalse(CorrelationContext.hasCorrelationId());
    }

    @Test
    @DisplayName("Missing or oversized header gets a generated id")
    void generatesId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/payouts");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "x".repeat(65));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertNotEquals("x".repeat(65), generated);
        assertFalse(generated.isBlank());
    }

    @Test
    @DisplayName("Actuator requests are not filtered")
    void skipsActuator() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/prometheus");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
