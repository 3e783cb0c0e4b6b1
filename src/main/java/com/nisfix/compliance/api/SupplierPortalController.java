package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.AnswersRequest;
import com.nisfix.compliance.api.dto.DocumentReportRequest;
import com.nisfix.compliance.api.dto.ReasonRequest;
import com.nisfix.compliance.application.AnswerInput;
import com.nisfix.compliance.application.RelationshipService;
import com.nisfix.compliance.application.RequirementService;
import com.nisfix.compliance.application.ResponseService;
import com.nisfix.compliance.application.ResponseService.SubmissionOutcome;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Endpoints used by supplier organizations: invitations, assigned requirements and responses.
 */
@RestController
@RequestMapping("/api/v1/supplier")
@Tag(name = "Supplier portal", description = "Supplier side of relationships and requirements")
public class SupplierPortalController {

    private static final Logger log = LoggerFactory.getLogger(SupplierPortalController.class);

    private final RelationshipService relationships;
    private final RequirementService requirements;
    private final ResponseService responses;

    public SupplierPortalController(RelationshipService relationships, RequirementService requirements,
                                    ResponseService responses) {
        this.relationships = relationships;
        this.requirements = requirements;
        this.responses = responses;
    }

    @GetMapping("/invitations")
    @Operation(summary = "Pending invitations addressed to the caller")
    public ResponseEntity<?> invitations(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(Map.of("items",
                relationships.pendingInvitations(user).stream().map(ApiViews::relationship).toList()));
    }

    @PostMapping("/invitations/{id}/accept")
    @Operation(summary = "Accept an invitation")
    public ResponseEntity<?> accept(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.relationship(relationships.accept(user, id)));
    }

    @PostMapping("/invitations/{id}/decline")
    @Operation(summary = "Decline an invitation")
    public ResponseEntity<?> decline(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                     @Valid @RequestBody(required = false) ReasonRequest body) {
        return ResponseEntity.ok(ApiViews.relationship(
                relationships.decline(user, id, SupplierController.reason(body))));
    }

    @GetMapping("/requirements")
    @Operation(summary = "Requirements assigned to the caller's organization")
    public ResponseEntity<?> listRequirements(@AuthenticationPrincipal AuthenticatedUser user,
                                              @RequestParam(required = false) RequirementStatus status,
                                              @RequestParam(defaultValue = "1") int page,
                                              @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                requirements.listForSupplier(user, status, PageQuery.of(page, limit)),
                ApiViews::requirement));
    }

    @GetMapping("/requirements/{id}")
    @Operation(summary = "Get an assigned requirement")
    public ResponseEntity<?> getRequirement(@AuthenticationPrincipal AuthenticatedUser user,
                                            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.requirement(requirements.getForSupplier(user, id)));
    }

    @PostMapping("/requirements/{id}/start")
    @Operation(summary = "Start working on a requirement", description = "Opens a draft response")
    public ResponseEntity<?> start(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.response(responses.start(user, id)));
    }

    @GetMapping("/responses/{id}")
    @Operation(summary = "Get a response")
    public ResponseEntity<?> getResponse(@AuthenticationPrincipal AuthenticatedUser user,
                                         @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.response(responses.get(user, id)));
    }

    @PostMapping("/responses/{id}/draft")
    @Operation(summary = "Save draft answers")
    public ResponseEntity<?> saveDraft(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                       @Valid @RequestBody AnswersRequest body) {
        return ResponseEntity.ok(ApiViews.response(responses.saveDraft(user, id, answers(body))));
    }

    @PostMapping("/responses/{id}/submit")
    @Operation(summary = "Submit questionnaire answers", description = "Scores the answers and freezes them")
    public ResponseEntity<?> submit(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody AnswersRequest body) {
        SubmissionOutcome outcome = responses.submitQuestionnaire(user, id, answers(body));
        log.info("Response {} submitted by {}", id, user.email());
        return ResponseEntity.ok(outcome(outcome));
    }

    @PostMapping("/responses/{id}/document")
    @Operation(summary = "Submit a security report grade")
    public ResponseEntity<?> submitDocument(@AuthenticationPrincipal AuthenticatedUser user,
                                            @PathVariable("id") UUID id,
                                            @Valid @RequestBody DocumentReportRequest body) {
        SubmissionOutcome outcome = responses.submitDocument(user, id, body.grade, body.reportDate, body.reference);
        log.info("Document report for response {} submitted by {}", id, user.email());
        return ResponseEntity.ok(outcome(outcome));
    }

    private static List<AnswerInput> answers(AnswersRequest body) {
        return body.answers.stream()
                .map(a -> new AnswerInput(a.questionId, a.selectedOptions, a.textAnswer))
                .toList();
    }

    private static Map<String, Object> outcome(SubmissionOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requirement", ApiViews.requirement(outcome.requirement()));
        body.put("response", ApiViews.response(outcome.response()));
        body.put("submission", ApiViews.submission(outcome.submission()));
        return body;
    }
}
