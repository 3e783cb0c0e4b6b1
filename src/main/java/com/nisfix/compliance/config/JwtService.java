package com.nisfix.compliance.config;

import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private final Key key;
    private final long accessTtlSeconds;
    private final long refreshTtlSeconds;
    private final Clock clock;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.access-ttl-seconds:3600}") long accessTtlSeconds,
            @Value("${security.jwt.refresh-ttl-seconds:2592000}") long refreshTtlSeconds,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTtlSeconds = accessTtlSeconds;
        this.refreshTtlSeconds = refreshTtlSeconds;
        this.clock = clock;
        log.info("JWT service initialized with access TTL: {} seconds, refresh TTL: {} seconds",
                accessTtlSeconds, refreshTtlSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    public TokenPair issuePair(User user, Organization organization) {
        return new TokenPair(
                generateToken(user, organization, TYPE_ACCESS, accessTtlSeconds),
                generateToken(user, organization, TYPE_REFRESH, refreshTtlSeconds),
                "Bearer",
                accessTtlSeconds);
    }

    private String generateToken(User user, Organization organization, String type, long ttlSeconds) {
        Instant now = clock.instant();
        log.debug("Generating {} token for user: {}, organization: {}", type, user.getId(), organization.getId());

        return Jwts.builder()
                .setSubject(user.getEmail())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim("userId", user.getId().toString())
                .claim("orgId", organization.getId().toString())
                .claim("role", user.getRole().name())
                .claim("orgType", organization.getType().name())
                .claim("type", type)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        try {
            return Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token);
        } catch (Exception e) {
            log.debug("Failed to parse JWT token: {}", e.getMessage());
            throw e;
        }
    }

    /** Resolves the caller of a valid access token; refresh tokens are rejected here. */
    public Optional<AuthenticatedUser> authenticate(String token) {
        return readPrincipal(token, TYPE_ACCESS);
    }

    public Optional<AuthenticatedUser> readRefreshToken(String token) {
        return readPrincipal(token, TYPE_REFRESH);
    }

    private Optional<AuthenticatedUser> readPrincipal(String token, String expectedType) {
        try {
            Claims claims = parse(token).getBody();
            if (!expectedType.equals(claims.get("type", String.class))) {
                log.warn("Rejected token of type {} where {} was expected", claims.get("type"), expectedType);
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedUser(
                    UUID.fromString(claims.get("userId", String.class)),
                    UUID.fromString(claims.get("orgId", String.class)),
                    claims.getSubject(),
                    UserRole.valueOf(claims.get("role", String.class)),
                    OrganizationType.valueOf(claims.get("orgType", String.class))));
        } catch (Exception e) {
            log.warn("Failed to read {} token: {}", expectedType, e.getMessage());
            return Optional.empty();
        }
    }

    public long getAccessTtlSeconds() {
        return accessTtlSeconds;
    }

    public record TokenPair(String accessToken, String refreshToken, String tokenType, long expiresIn) {}
}
