package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.ClassificationRequest;
import com.nisfix.compliance.api.dto.InviteSupplierRequest;
import com.nisfix.compliance.api.dto.ReasonRequest;
import com.nisfix.compliance.api.dto.UpdateRelationshipRequest;
import com.nisfix.compliance.application.RelationshipService;
import com.nisfix.compliance.application.RelationshipService.InviteSupplierCommand;
import com.nisfix.compliance.application.RelationshipService.RelationshipStats;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.relationship.Relationship;
import com.nisfix.compliance.domain.relationship.RelationshipStatus;
import com.nisfix.compliance.domain.relationship.SupplierClassification;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Company view of its suppliers.
 */
@RestController
@RequestMapping("/api/v1/suppliers")
@Tag(name = "Suppliers", description = "Company-supplier relationships")
public class SupplierController {

    private final RelationshipService relationships;

    public SupplierController(RelationshipService relationships) {
        this.relationships = relationships;
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Invite a supplier by email")
    public ResponseEntity<?> invite(@AuthenticationPrincipal AuthenticatedUser user,
                                    @Valid @RequestBody InviteSupplierRequest body) {
        Relationship created = relationships.invite(user, new InviteSupplierCommand(body.email,
                body.classification, body.notes, body.servicesProvided, body.contractRef));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.relationship(created));
    }

    @GetMapping
    @Operation(summary = "List suppliers", description = "Newest first, optionally filtered")
    public ResponseEntity<?> list(@AuthenticationPrincipal AuthenticatedUser user,
                                  @RequestParam(required = false) RelationshipStatus status,
                                  @RequestParam(required = false) SupplierClassification classification,
                                  @RequestParam(defaultValue = "1") int page,
                                  @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                relationships.list(user, status, classification, PageQuery.of(page, limit)),
                ApiViews::relationship));
    }

    @GetMapping("/stats")
    @Operation(summary = "Supplier counts by status and classification")
    public ResponseEntity<?> stats(@AuthenticationPrincipal AuthenticatedUser user) {
        RelationshipStats stats = relationships.stats(user);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", stats.total());
        body.put("byStatus", stats.byStatus());
        body.put("byClassification", stats.byClassification());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a supplier relationship")
    public ResponseEntity<?> get(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.relationship(relationships.get(user, id)));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update notes, services and contract reference")
    public ResponseEntity<?> update(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody UpdateRelationshipRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(
                relationships.updateDetails(user, id, body.notes, body.servicesProvided, body.contractRef)));
    }

    @PatchMapping("/{id}/classification")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Change supplier classification")
    public ResponseEntity<?> classify(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                      @Valid @RequestBody ClassificationRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(
                relationships.updateClassification(user, id, body.classification)));
    }

    @PostMapping("/{id}/suspend")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Suspend an active supplier")
    public ResponseEntity<?> suspend(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                     @Valid @RequestBody(required = false) ReasonRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(relationships.suspend(user, id, reason(body))));
    }

    @PostMapping("/{id}/reactivate")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Reactivate a suspended supplier")
    public ResponseEntity<?> reactivate(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                        @Valid @RequestBody(required = false) ReasonRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(relationships.reactivate(user, id, reason(body))));
    }

    @PostMapping("/{id}/terminate")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Terminate a supplier relationship")
    public ResponseEntity<?> terminate(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                       @Valid @RequestBody(required = false) ReasonRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(relationships.terminate(user, id, reason(body))));
    }

    static String reason(ReasonRequest body) {
        return body == null ? null : body.reason;
    }
}
