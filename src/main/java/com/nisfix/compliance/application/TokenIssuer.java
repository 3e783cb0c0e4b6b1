package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.ports.SecureLinkRepository;
import com.nisfix.compliance.exception.AlreadyUsedException;
import com.nisfix.compliance.exception.ExpiredException;
import com.nisfix.compliance.exception.InvalidLinkException;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Issues and redeems single-use secure links.
 *
 * <p>A link is usable while it is valid, unused and not expired. Redemption marks it used with a
 * conditional update, so of two concurrent redemptions exactly one succeeds.
 */
@Service
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);
    private static final int IDENTIFIER_BYTES = 32;

    private final SecureLinkRepository links;
    private final AppProperties props;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TokenIssuer(SecureLinkRepository links, AppProperties props, Clock clock) {
        this.links = links;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Fails once the email reached the maximum number of sign-in links within the trailing window.
     */
    @Transactional(readOnly = true)
    public void checkRateLimit(String email) {
        AppProperties.MagicLink cfg = props.getMagicLink();
        OffsetDateTime since = OffsetDateTime.now(clock).minusMinutes(cfg.getRateLimitWindowMinutes());
        long recent = links.countCreatedSince(User.normalizeEmail(email), SecureLinkType.AUTH, since);
        if (recent >= cfg.getRateLimitMax()) {
            log.warn("Magic link rate limit reached for {} ({} links in {} minutes)",
                    email, recent, cfg.getRateLimitWindowMinutes());
            throw new RateLimitExceededException("too many sign-in links requested, try again later",
                    cfg.getRateLimitWindowMinutes());
        }
    }

    @Transactional
    public SecureLink issue(String email, SecureLinkType type, UUID userId, UUID relationshipId, Duration validity) {
        String normalized = User.normalizeEmail(email);
        if (type == SecureLinkType.AUTH) {
            invalidatePrevious(normalized);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        SecureLink link = new SecureLink(UUID.randomUUID(), generateIdentifier(), type, normalized, userId,
                relationshipId, now.plus(validity), true, null, now);
        links.save(link);
        log.info("Issued {} link for {} expiring at {}", type, normalized, link.getExpiresAt());
        return link;
    }

    public SecureLink issueSignInLink(User user) {
        return issue(user.getEmail(), SecureLinkType.AUTH, user.getId(), null,
                Duration.ofMinutes(props.getMagicLink().getValidityMinutes()));
    }

    public SecureLink issueInvitationLink(String email, UUID relationshipId) {
        return issue(email, SecureLinkType.INVITATION, null, relationshipId,
                Duration.ofDays(props.getInvitation().getValidityDays()));
    }

    // Best effort: a failed invalidation must not block issuing the new link
    private void invalidatePrevious(String email) {
        try {
            int invalidated = links.invalidateActive(email, SecureLinkType.AUTH);
            if (invalidated > 0) {
                log.debug("Invalidated {} previous sign-in links for {}", invalidated, email);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to invalidate previous sign-in links for {}: {}", email, e.getMessage());
        }
    }

    /**
     * Consumes a link of the expected type. Expiry is checked before any other state.
     *
     * @return the link as it was before consumption
     */
    @Transactional
    public SecureLink redeem(String identifier, SecureLinkType expectedType) {
        SecureLink link = links.findByIdentifier(identifier)
                .orElseThrow(() -> new NotFoundException("link not found"));
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (link.isExpired(now)) {
            throw new ExpiredException("this link has expired");
        }
        if (link.isUsed()) {
            throw new AlreadyUsedException("this link has already been used");
        }
        if (!link.isValid() || link.getType() != expectedType) {
            throw new InvalidLinkException("this link is no longer valid");
        }
        if (!links.consume(identifier, now)) {
            log.warn("Lost redemption race for link {}", link.getId());
            throw new AlreadyUsedException("this link has already been used");
        }
        log.info("Redeemed {} link {} for {}", link.getType(), link.getId(), link.getEmail());
        return link;
    }

    @Transactional
    public int purgeExpired() {
        int deleted = links.deleteExpiredBefore(OffsetDateTime.now(clock));
        if (deleted > 0) {
            log.info("Deleted {} expired secure links", deleted);
        }
        return deleted;
    }

    String generateIdentifier() {
        byte[] bytes = new byte[IDENTIFIER_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
