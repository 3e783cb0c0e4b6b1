package com.nisfix.compliance.application;

import com.nisfix.compliance.config.AppProperties;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.SecureLinkType;
import com.nisfix.compliance.domain.ports.SecureLinkRepository;
import com.nisfix.compliance.exception.AlreadyUsedException;
import com.nisfix.compliance.exception.ExpiredException;
import com.nisfix.compliance.exception.InvalidLinkException;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenIssuerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private SecureLinkRepository links;

    private TokenIssuer issuer;

    @BeforeEach
    void setUp() {
        issuer = new TokenIssuer(links, new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static OffsetDateTime now() {
        return NOW.atOffset(ZoneOffset.UTC);
    }

    private static SecureLink link(SecureLinkType type, OffsetDateTime expiresAt, boolean valid,
                                   OffsetDateTime usedAt) {
        return new SecureLink(UUID.randomUUID(), "abc", type, "user@acme.test", UUID.randomUUID(), null,
                expiresAt, valid, usedAt, now().minusMinutes(5));
    }

    @Test
    void shouldIssueNormalizedLinkWithRandomIdentifier() {
        SecureLink issued = issuer.issue("  User@ACME.test ", SecureLinkType.AUTH, UUID.randomUUID(), null,
                Duration.ofMinutes(15));

        ArgumentCaptor<SecureLink> saved = ArgumentCaptor.forClass(SecureLink.class);
        verify(links).save(saved.capture());
        verify(links).invalidateActive("user@acme.test", SecureLinkType.AUTH);
        assertThat(saved.getValue().getEmail()).isEqualTo("user@acme.test");
        assertThat(issued.getIdentifier()).hasSize(64).matches("[0-9a-f]+");
        assertThat(issued.getExpiresAt()).isEqualTo(now().plusMinutes(15));
        assertThat(issued.isValid()).isTrue();
    }

    @Test
    void shouldIssueEvenWhenInvalidationFails() {
        when(links.invalidateActive(anyString(), any())).thenThrow(new IllegalStateException("db down"));

        SecureLink issued = issuer.issue("user@acme.test", SecureLinkType.AUTH, UUID.randomUUID(), null,
                Duration.ofMinutes(15));

        assertThat(issued).isNotNull();
        verify(links).save(any());
    }

    @Test
    void shouldNotInvalidateOtherLinksForInvitations() {
        issuer.issueInvitationLink("vendor@acme.test", UUID.randomUUID());

        verify(links, never()).invalidateActive(anyString(), any());
    }

    @Test
    void shouldGenerateDistinctIdentifiers() {
        assertThat(issuer.generateIdentifier()).isNotEqualTo(issuer.generateIdentifier());
    }

    @Test
    void shouldRejectFourthLinkWithinWindow() {
        when(links.countCreatedSince(eq("user@acme.test"), eq(SecureLinkType.AUTH), any())).thenReturn(3L);

        assertThatThrownBy(() -> issuer.checkRateLimit("User@acme.test"))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> assertThat(((RateLimitExceededException) e).getWindowMinutes()).isEqualTo(60));
        verify(links).countCreatedSince("user@acme.test", SecureLinkType.AUTH, now().minusMinutes(60));
    }

    @Test
    void shouldAllowLinksBelowLimit() {
        when(links.countCreatedSince(anyString(), any(), any())).thenReturn(2L);

        issuer.checkRateLimit("user@acme.test");
    }

    @Test
    void shouldRedeemUsableLinkOnce() {
        SecureLink link = link(SecureLinkType.AUTH, now().plusMinutes(10), true, null);
        when(links.findByIdentifier("abc")).thenReturn(Optional.of(link));
        when(links.consume("abc", now())).thenReturn(true);

        assertThat(issuer.redeem("abc", SecureLinkType.AUTH)).isSameAs(link);
    }

    @Test
    void shouldReportLostRaceAsAlreadyUsed() {
        when(links.findByIdentifier("abc"))
                .thenReturn(Optional.of(link(SecureLinkType.AUTH, now().plusMinutes(10), true, null)));
        when(links.consume("abc", now())).thenReturn(false);

        assertThatThrownBy(() -> issuer.redeem("abc", SecureLinkType.AUTH))
                .isInstanceOf(AlreadyUsedException.class);
    }

    @Test
    void shouldCheckExpiryBeforeUse() {
        when(links.findByIdentifier("abc"))
                .thenReturn(Optional.of(link(SecureLinkType.AUTH, now().minusMinutes(1), false, now().minusMinutes(2))));

        assertThatThrownBy(() -> issuer.redeem("abc", SecureLinkType.AUTH))
                .isInstanceOf(ExpiredException.class);
        verify(links, never()).consume(anyString(), any());
    }

    @Test
    void shouldRejectUsedInvalidatedAndMismatchedLinks() {
        when(links.findByIdentifier("used"))
                .thenReturn(Optional.of(link(SecureLinkType.AUTH, now().plusMinutes(5), false, now())));
        when(links.findByIdentifier("revoked"))
                .thenReturn(Optional.of(link(SecureLinkType.AUTH, now().plusMinutes(5), false, null)));
        when(links.findByIdentifier("invite"))
                .thenReturn(Optional.of(link(SecureLinkType.INVITATION, now().plusDays(5), true, null)));

        assertThatThrownBy(() -> issuer.redeem("used", SecureLinkType.AUTH))
                .isInstanceOf(AlreadyUsedException.class);
        assertThatThrownBy(() -> issuer.redeem("revoked", SecureLinkType.AUTH))
                .isInstanceOf(InvalidLinkException.class);
        assertThatThrownBy(() -> issuer.redeem("invite", SecureLinkType.AUTH))
                .isInstanceOf(InvalidLinkException.class);
    }

    @Test
    void shouldFailForUnknownIdentifier() {
        when(links.findByIdentifier("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> issuer.redeem("missing", SecureLinkType.AUTH))
                .isInstanceOf(NotFoundException.class);
    }
}
