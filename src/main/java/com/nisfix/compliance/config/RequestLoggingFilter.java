package com.nisfix.compliance.config;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Enumeration;
import java.util.Locale;
import java.util.UUID;

/**
 * Tags every request with a request id and logs one completion line naming the caller's organization.
 * Health endpoint calls are logged at debug only.
 */
@Component
@Order(1)
public class RequestLoggingFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String ORGANIZATION_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".organizationId";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = resolveRequestId(httpRequest.getHeader(REQUEST_ID_HEADER));
        MDC.put("requestId", requestId);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        String method = httpRequest.getMethod();
        String uri = httpRequest.getRequestURI();
        boolean quiet = uri.startsWith("/actuator/health");

        if (log.isDebugEnabled()) {
            Enumeration<String> headerNames = httpRequest.getHeaderNames();
            while (headerNames.hasMoreElements()) {
                String headerName = headerNames.nextElement();
                log.debug("{} {} header {} = {}", method, uri, headerName,
                        maskHeader(headerName, httpRequest.getHeader(headerName)));
            }
        }

        long startTime = System.currentTimeMillis();
        try {
            chain.doFilter(request, response);
            String line = "{} {} -> {} in {}ms (org {})";
            Object[] args = {method, uri, httpResponse.getStatus(), System.currentTimeMillis() - startTime,
                    organizationOf(httpRequest)};
            if (quiet) {
                log.debug(line, args);
            } else {
                log.info(line, args);
            }
        } catch (Exception e) {
            log.error("{} {} failed for org {}: {}", method, uri, organizationOf(httpRequest), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("requestId");
        }
    }

    // the JWT filter clears its MDC entry before control returns here, so the tenant travels as an attribute
    static String organizationOf(HttpServletRequest request) {
        Object organizationId = request.getAttribute(ORGANIZATION_ATTRIBUTE);
        return organizationId == null ? "-" : organizationId.toString();
    }

    static String resolveRequestId(String header) {
        if (StringUtils.hasText(header) && header.length() <= MAX_REQUEST_ID_LENGTH
                && header.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
            return header;
        }
        return UUID.randomUUID().toString();
    }

    static String maskHeader(String name, String value) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("authorization")) {
            return value != null && value.startsWith("Bearer ") ? "Bearer ***" : "***";
        }
        return lower.equals("cookie") ? "***" : value;
    }
}
