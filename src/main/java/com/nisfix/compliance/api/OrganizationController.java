package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.UpdateOrganizationRequest;
import com.nisfix.compliance.api.dto.UpdateSettingsRequest;
import com.nisfix.compliance.application.OrganizationService;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.Organization;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/organization")
@Tag(name = "Organization", description = "The caller's own organization")
public class OrganizationController {

    private final OrganizationService organizations;

    public OrganizationController(OrganizationService organizations) {
        this.organizations = organizations;
    }

    @GetMapping
    @Operation(summary = "Get the caller's organization")
    public ResponseEntity<?> get(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(ApiViews.organization(organizations.get(user.organizationId())));
    }

    @PatchMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update the organization profile")
    public ResponseEntity<?> update(@AuthenticationPrincipal AuthenticatedUser user,
                                    @Valid @RequestBody UpdateOrganizationRequest body) {
        Organization org = organizations.updateProfile(user.organizationId(), body.name, body.domain,
                body.contactEmail, body.contactPhone, body.address);
        return ResponseEntity.ok(ApiViews.organization(org));
    }

    @GetMapping("/settings")
    @Operation(summary = "Get organization settings")
    public ResponseEntity<?> settings(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(ApiViews.settings(organizations.get(user.organizationId()).getSettings()));
    }

    @PatchMapping("/settings")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update organization settings")
    public ResponseEntity<?> updateSettings(@AuthenticationPrincipal AuthenticatedUser user,
                                            @Valid @RequestBody UpdateSettingsRequest body) {
        return ResponseEntity.ok(ApiViews.settings(organizations.updateSettings(user.organizationId(),
                body.defaultDueDays, body.reminderDaysBefore, body.requireApproval, body.notificationsEnabled)));
    }
}
