package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.config.JwtService;
import com.nisfix.compliance.config.JwtService.TokenPair;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.NotifierPort;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
import com.nisfix.compliance.exception.InvalidLinkException;
import com.nisfix.compliance.exception.InvalidTokenException;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Passwordless authentication: magic links, token refresh and supplier onboarding through
 * invitation links.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final TokenIssuer tokenIssuer;
    private final UserRepository users;
    private final OrganizationRepository organizations;
    private final JwtService jwtService;
    private final NotifierPort notifier;
    private final AppProperties props;
    private final Clock clock;

    public AuthService(TokenIssuer tokenIssuer, UserRepository users, OrganizationRepository organizations,
                       JwtService jwtService, NotifierPort notifier, AppProperties props, Clock clock) {
        this.tokenIssuer = tokenIssuer;
        this.users = users;
        this.organizations = organizations;
        this.jwtService = jwtService;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Sends a sign-in link when the email belongs to an active user of a live organization.
     * Unknown emails return silently so callers cannot enumerate accounts.
     */
    @Transactional
    public void requestMagicLink(String email) {
        String normalized = User.normalizeEmail(email);
        tokenIssuer.checkRateLimit(normalized);

        Optional<User> user = users.findByEmail(normalized).filter(User::canLogin);
        if (user.isEmpty()) {
            log.info("Magic link requested for unknown or inactive email {}", normalized);
            return;
        }
        Optional<Organization> org = organizations.findById(user.get().getOrganizationId())
                .filter(o -> !o.isDeleted());
        if (org.isEmpty()) {
            log.warn("Magic link requested for user {} of a missing organization", user.get().getId());
            return;
        }

        SecureLink link = tokenIssuer.issueSignInLink(user.get());
        notifier.sendMagicLink(normalized, user.get().getName(), signInUrl(props.getMagicLink().getBaseUrl(), link),
                link.getExpiresAt());
        log.info("Magic link sent to user {}", user.get().getId());
    }

    public static String signInUrl(String baseUrl, SecureLink link) {
        return trimTrailingSlash(baseUrl) + "/auth/verify/" + link.getIdentifier();
    }

    static String trimTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Transactional
    public AuthResult verify(String identifier) {
        SecureLink link = tokenIssuer.redeem(identifier, SecureLinkType.AUTH);
        User user = loadLoginUser(link.getUserId() != null
                ? users.findById(link.getUserId()) : users.findByEmail(link.getEmail()));
        Organization org = loadLiveOrganization(user.getOrganizationId());

        users.updateLastLogin(user.getId(), OffsetDateTime.now(clock));
        log.info("User {} signed in to organization {}", user.getId(), org.getId());
        return new AuthResult(jwtService.issuePair(user, org), user, org);
    }

    @Transactional(readOnly = true)
    public AuthResult refresh(String refreshToken) {
        AuthenticatedUser principal = jwtService.readRefreshToken(refreshToken)
                .orElseThrow(() -> new InvalidTokenException("invalid or expired refresh token"));
        User user = users.findById(principal.userId())
                .filter(User::canLogin)
                .orElseThrow(() -> new InvalidTokenException("invalid or expired refresh token"));
        Organization org = organizations.findById(user.getOrganizationId())
                .filter(o -> !o.isDeleted())
                .orElseThrow(() -> new InvalidTokenException("invalid or expired refresh token"));
        log.debug("Refreshed tokens for user {}", user.getId());
        return new AuthResult(jwtService.issuePair(user, org), user, org);
    }

    /** Tokens are stateless; logging out only needs the client to drop them. */
    public void logout(AuthenticatedUser principal) {
        log.info("User {} logged out", principal.userId());
    }

    @Transactional(readOnly = true)
    public AuthResult me(AuthenticatedUser principal) {
        User user = users.findById(principal.userId())
                .orElseThrow(() -> new NotFoundException("User", principal.userId()));
        Organization org = organizations.findById(user.getOrganizationId())
                .orElseThrow(() -> new NotFoundException("Organization", user.getOrganizationId()));
        return new AuthResult(null, user, org);
    }

    /**
     * Consumes an invitation link. A first-time supplier gets a new supplier organization with
     * itself as admin; an existing user simply signs in.
     */
    @Transactional
    public AuthResult redeemInvitation(String identifier, String organizationName, String name) {
        SecureLink link = tokenIssuer.redeem(identifier, SecureLinkType.INVITATION);
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<User> existing = users.findByEmail(link.getEmail());
        User user;
        Organization org;
        if (existing.isPresent()) {
            user = loadLoginUser(existing);
            org = loadLiveOrganization(user.getOrganizationId());
        } else {
            if (organizationName == null || organizationName.isBlank()) {
                throw new ValidationFailedException("organizationName is required for a new supplier");
            }
            org = organizations.save(Organization.create(OrganizationType.SUPPLIER, organizationName.trim(),
                    null, link.getEmail(), now));
            String displayName = name == null || name.isBlank() ? link.getEmail() : name.trim();
            user = users.save(User.create(link.getEmail(), displayName, UserRole.ADMIN, org.getId(), now));
            log.info("Created supplier organization {} with admin {} from invitation", org.getId(), user.getId());
        }

        users.updateLastLogin(user.getId(), now);
        return new AuthResult(jwtService.issuePair(user, org), user, org);
    }

    private User loadLoginUser(Optional<User> candidate) {
        return candidate.filter(User::canLogin)
                .orElseThrow(() -> new InvalidLinkException("this link is no longer valid"));
    }

    private Organization loadLiveOrganization(UUID organizationId) {
        return organizations.findById(organizationId)
                .filter(o -> !o.isDeleted())
                .orElseThrow(() -> new InvalidLinkException("this link is no longer valid"));
    }

    /** Tokens are null for {@link #me}. */
    public record AuthResult(TokenPair tokens, User user, Organization organization) {}
}
