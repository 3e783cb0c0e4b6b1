package com.nisfix.compliance.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates requests carrying an access token. Requests without one continue unauthenticated
 * and are rejected by the security chain where a login is required.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private final JwtService jwt;

    public JwtAuthFilter(JwtService jwt) {
        this.jwt = jwt;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();
        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }
        if (SecurityConfig.isPublicPath(path)) {
            log.debug("JwtAuthFilter: Skipping public endpoint: {}", path);
            return true;
        }
        return false;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        try {
            String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
            if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
                log.debug("JwtAuthFilter: No bearer token for {} {}", method, path);
                chain.doFilter(request, response);
                return;
            }

            Optional<AuthenticatedUser> principal = jwt.authenticate(authHeader.substring(7).trim());
            if (principal.isEmpty()) {
                log.warn("JwtAuthFilter: Invalid or expired token for {} {}", method, path);
                chain.doFilter(request, response);
                return;
            }

            AuthenticatedUser user = principal.get();
            List<SimpleGrantedAuthority> authorities = List.of(
                    new SimpleGrantedAuthority("ROLE_" + user.role().name()),
                    new SimpleGrantedAuthority("ROLE_" + user.organizationType().name()));
            SecurityContextHolder.getContext().setAuthentication(
                    new UsernamePasswordAuthenticationToken(user, null, authorities));

            // tenant comes from the verified token only, never from request headers
            TenantContext.setOrganizationId(user.organizationId());
            MDC.put("orgId", user.organizationId().toString());
            request.setAttribute(RequestLoggingFilter.ORGANIZATION_ATTRIBUTE, user.organizationId());
            log.debug("JwtAuthFilter: Authenticated user {} of {} {} for {} {}", user.userId(),
                    user.organizationType(), user.organizationId(), method, path);

            chain.doFilter(request, response);
        } catch (Exception e) {
            log.error("JwtAuthFilter: Error in JWT filter for {} {}: {}", method, path, e.getMessage(), e);
            SecurityContextHolder.clearContext();
            chain.doFilter(request, response);
        } finally {
            TenantContext.clear();
            MDC.remove("orgId");
        }
    }
}
