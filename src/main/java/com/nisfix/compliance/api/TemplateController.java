package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.PublishTemplateRequest;
import com.nisfix.compliance.api.dto.QuestionnaireRequest;
import com.nisfix.compliance.api.dto.TemplateRequest;
import com.nisfix.compliance.application.TemplateService;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.domain.template.TemplateCategory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/templates")
@Tag(name = "Templates", description = "System and company questionnaire templates")
public class TemplateController {

    private final TemplateService templates;

    public TemplateController(TemplateService templates) {
        this.templates = templates;
    }

    @GetMapping
    @Operation(summary = "List templates available to the company",
            description = "System templates, globally published templates and the company's own")
    public ResponseEntity<?> listAvailable(@AuthenticationPrincipal AuthenticatedUser user,
                                           @RequestParam(required = false) TemplateCategory category,
                                           @RequestParam(defaultValue = "1") int page,
                                           @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                templates.listAvailable(user.organizationId(), category, PageQuery.of(page, limit)),
                ApiViews::template));
    }

    @GetMapping("/organization")
    @Operation(summary = "List templates owned by the company")
    public ResponseEntity<?> listOrganization(@AuthenticationPrincipal AuthenticatedUser user,
                                              @RequestParam(defaultValue = "1") int page,
                                              @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                templates.listForOrganization(user.organizationId(), PageQuery.of(page, limit)),
                ApiViews::template));
    }

    @GetMapping("/mine")
    @Operation(summary = "List templates created by the current user")
    public ResponseEntity<?> listMine(@AuthenticationPrincipal AuthenticatedUser user,
                                      @RequestParam(defaultValue = "1") int page,
                                      @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                templates.listCreatedBy(user.userId(), PageQuery.of(page, limit)), ApiViews::template));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a template")
    public ResponseEntity<?> get(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.template(templates.get(user.organizationId(), id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Create a draft template")
    public ResponseEntity<?> create(@AuthenticationPrincipal AuthenticatedUser user,
                                    @Validated(QuestionnaireRequest.Create.class) @RequestBody TemplateRequest body) {
        QuestionnaireTemplate created = templates.create(user, body.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.template(created));
    }

    @PostMapping("/import")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Import a template document as a draft")
    public ResponseEntity<?> importTemplate(@AuthenticationPrincipal AuthenticatedUser user,
                                            @RequestBody String content) {
        QuestionnaireTemplate created = templates.importTemplate(user, content);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.template(created));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update a draft template")
    public ResponseEntity<?> update(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody TemplateRequest body) {
        return ResponseEntity.ok(ApiViews.template(templates.update(user, id, body.toDefinition())));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Delete an unused company template")
    public ResponseEntity<?> delete(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        templates.delete(user, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/publish")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Publish a draft template", description = "Visibility LOCAL or GLOBAL")
    public ResponseEntity<?> publish(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                     @Valid @RequestBody PublishTemplateRequest body) {
        return ResponseEntity.ok(ApiViews.template(templates.publish(user, id, body.visibility)));
    }

    @PostMapping("/{id}/unpublish")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Revert an unused template to draft")
    public ResponseEntity<?> unpublish(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.template(templates.unpublish(user, id)));
    }
}
