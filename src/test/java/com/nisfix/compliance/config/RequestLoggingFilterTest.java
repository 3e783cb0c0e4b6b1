package com.nisfix.compliance.config;

import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    void shouldEchoCallerRequestIdAndExposeItToDownstreamLogging() throws IOException, ServletException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/requirements");
        request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seenInChain.set(MDC.get("requestId"));
            }
        });

        assertThat(seenInChain.get()).isEqualTo("req-42");
        assertThat(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void shouldReplaceMalformedRequestId() throws IOException, ServletException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/suppliers");
        request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "bad id\nforged log line");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String issued = response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER);
        assertThat(issued).isNotEqualTo("bad id\nforged log line");
        assertThat(UUID.fromString(issued)).isNotNull();
    }

    @Test
    void shouldReportOrganizationSetByAuthentication() {
        UUID organizationId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/suppliers");

        assertThat(RequestLoggingFilter.organizationOf(request)).isEqualTo("-");

        request.setAttribute(RequestLoggingFilter.ORGANIZATION_ATTRIBUTE, organizationId);
        assertThat(RequestLoggingFilter.organizationOf(request)).isEqualTo(organizationId.toString());
    }

    @Test
    void shouldMaskCredentialsInHeaderDump() {
        assertThat(RequestLoggingFilter.maskHeader("Authorization", "Bearer abc.def")).isEqualTo("Bearer ***");
        assertThat(RequestLoggingFilter.maskHeader("authorization", "Basic Zm9v")).isEqualTo("***");
        assertThat(RequestLoggingFilter.maskHeader("Cookie", "session=1")).isEqualTo("***");
        assertThat(RequestLoggingFilter.maskHeader("Accept", "application/json")).isEqualTo("application/json");
    }
}
