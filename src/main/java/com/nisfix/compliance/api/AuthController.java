package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.MagicLinkRequest;
import com.nisfix.compliance.api.dto.RedeemInvitationRequest;
import com.nisfix.compliance.api.dto.RefreshRequest;
import com.nisfix.compliance.api.dto.VerifyRequest;
import com.nisfix.compliance.application.AuthService;
import com.nisfix.compliance.application.AuthService.AuthResult;
import com.nisfix.compliance.config.AuthenticatedUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Magic link sign-in and token management")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String MAGIC_LINK_SENT = "If an account exists for this email, a sign-in link has been sent";

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/magic-link")
    @Operation(summary = "Request a sign-in link", description = "Always answers the same message for unknown emails")
    public ResponseEntity<?> requestMagicLink(@Valid @RequestBody MagicLinkRequest body) {
        authService.requestMagicLink(body.email);
        return ResponseEntity.ok(Map.of("message", MAGIC_LINK_SENT));
    }

    @PostMapping("/verify")
    @Operation(summary = "Exchange a sign-in link for tokens")
    public ResponseEntity<?> verify(@Valid @RequestBody VerifyRequest body) {
        AuthResult result = authService.verify(body.token);
        return ResponseEntity.ok(ApiViews.tokens(result.tokens(), result.user(), result.organization()));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Issue a new token pair from a refresh token")
    public ResponseEntity<?> refresh(@Valid @RequestBody RefreshRequest body) {
        AuthResult result = authService.refresh(body.refreshToken);
        return ResponseEntity.ok(ApiViews.tokens(result.tokens(), result.user(), result.organization()));
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Tokens are stateless; the client discards them")
    public ResponseEntity<?> logout(@AuthenticationPrincipal AuthenticatedUser user) {
        authService.logout(user);
        return ResponseEntity.ok(Map.of("message", "Logged out"));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user and organization")
    public ResponseEntity<?> me(@AuthenticationPrincipal AuthenticatedUser user) {
        AuthResult result = authService.me(user);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", ApiViews.user(result.user()));
        body.put("organization", ApiViews.organization(result.organization()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/invitations/redeem")
    @Operation(summary = "Redeem a supplier invitation link",
            description = "Creates the supplier organization and its admin on first use")
    public ResponseEntity<?> redeemInvitation(@Valid @RequestBody RedeemInvitationRequest body) {
        AuthResult result = authService.redeemInvitation(body.token, body.organizationName, body.name);
        log.info("Invitation redeemed by {}", result.user().getEmail());
        return ResponseEntity.ok(ApiViews.tokens(result.tokens(), result.user(), result.organization()));
    }
}
