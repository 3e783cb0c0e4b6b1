package com.nisfix.compliance.config;

import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

@Configuration
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    static final String[] PUBLIC_PATHS = {
            "/api/v1/auth/magic-link",
            "/api/v1/auth/verify",
            "/api/v1/auth/refresh",
            "/api/v1/auth/invitations/redeem",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/actuator/health",
            "/actuator/health/**",
            "/actuator/info"
    };

    static boolean isPublicPath(String path) {
        for (String p : PUBLIC_PATHS) {
            if (p.endsWith("/**") ? path.startsWith(p.substring(0, p.length() - 3)) : path.equals(p)) {
                return true;
            }
        }
        return false;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(List.of("*"));
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS", "HEAD"));
        configuration.setAllowedHeaders(Arrays.asList(
                "Authorization",
                "Content-Type",
                "X-Requested-With",
                "Accept",
                "Origin",
                "Access-Control-Request-Method",
                "Access-Control-Request-Headers"));
        configuration.setAllowCredentials(true);
        configuration.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }

    @Bean
    SecurityFilterChain security(HttpSecurity http, JwtService jwtService) throws Exception {
        JwtAuthFilter jwtFilter = new JwtAuthFilter(jwtService);

        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(PUBLIC_PATHS).permitAll()
                        .requestMatchers("/actuator/**").hasRole("ADMIN")

                        // company side
                        .requestMatchers("/api/v1/suppliers/**", "/api/v1/requirements/**",
                                "/api/v1/questionnaires/**", "/api/v1/questions/**",
                                "/api/v1/templates/**").hasRole("COMPANY")

                        // supplier portal
                        .requestMatchers("/api/v1/supplier/**").hasRole("SUPPLIER")

                        .anyRequest().authenticated())
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
                .exceptionHandling(e -> e
                        .authenticationEntryPoint(json401())
                        .accessDeniedHandler(json403()));

        log.info("Security filter chain configured");
        return http.build();
    }

    private AuthenticationEntryPoint json401() {
        return (request, response, ex) -> {
            log.warn("Authentication failed for {} {}: {}",
                    request.getMethod(), request.getRequestURI(), ex.getMessage());
            writeError(response, 401, "UNAUTHORIZED", "Valid Bearer token required", request.getRequestURI());
        };
    }

    private AccessDeniedHandler json403() {
        return (request, response, ex) -> {
            log.warn("Access denied for {} {}: {}",
                    request.getMethod(), request.getRequestURI(), ex.getMessage());
            writeError(response, 403, "FORBIDDEN", "Insufficient role", request.getRequestURI());
        };
    }

    private static void writeError(HttpServletResponse response, int status, String error,
                                   String message, String path) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(
                "{\"error\":\"" + error + "\"," +
                        "\"message\":\"" + message + "\"," +
                        "\"status\":" + status + "," +
                        "\"timestamp\":\"" + OffsetDateTime.now() + "\"," +
                        "\"path\":\"" + path + "\"}");
    }
}
