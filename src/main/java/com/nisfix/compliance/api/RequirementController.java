package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.CreateRequirementRequest;
import com.nisfix.compliance.api.dto.ReviewRequest;
import com.nisfix.compliance.api.dto.UpdateRequirementRequest;
import com.nisfix.compliance.application.RequirementService;
import com.nisfix.compliance.application.RequirementService.CreateRequirementCommand;
import com.nisfix.compliance.application.RequirementService.RequirementStats;
import com.nisfix.compliance.application.RequirementService.UpdateRequirementCommand;
import com.nisfix.compliance.application.RequirementView;
import com.nisfix.compliance.application.ReviewService;
import com.nisfix.compliance.application.ReviewService.ReviewCommand;
import com.nisfix.compliance.application.ReviewService.ReviewView;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Company side of requirements: assignment, tracking and review.
 */
@RestController
@RequestMapping("/api/v1/requirements")
@Tag(name = "Requirements", description = "Assign and review supplier requirements")
public class RequirementController {

    private static final Logger log = LoggerFactory.getLogger(RequirementController.class);

    private final RequirementService requirements;
    private final ReviewService reviews;
    private final Clock clock;

    public RequirementController(RequirementService requirements, ReviewService reviews, Clock clock) {
        this.requirements = requirements;
        this.reviews = reviews;
        this.clock = clock;
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Assign a requirement to an active supplier")
    public ResponseEntity<?> create(@AuthenticationPrincipal AuthenticatedUser user,
                                    @Valid @RequestBody CreateRequirementRequest body) {
        Requirement created = requirements.create(user, new CreateRequirementCommand(body.relationshipId,
                body.type, body.title, body.description, body.priority, body.dueDate, body.questionnaireId,
                body.passingScore, body.minimumGrade, body.maxReportAgeDays));
        return ResponseEntity.status(HttpStatus.CREATED).body(view(created));
    }

    @GetMapping
    @Operation(summary = "List requirements", description = "Filter by status or relationship")
    public ResponseEntity<?> list(@AuthenticationPrincipal AuthenticatedUser user,
                                  @RequestParam(required = false) RequirementStatus status,
                                  @RequestParam(required = false) UUID relationshipId,
                                  @RequestParam(defaultValue = "1") int page,
                                  @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                requirements.list(user, status, relationshipId, PageQuery.of(page, limit)),
                ApiViews::requirement));
    }

    @GetMapping("/stats")
    @Operation(summary = "Requirement counts by status, plus overdue")
    public ResponseEntity<?> stats(@AuthenticationPrincipal AuthenticatedUser user) {
        RequirementStats stats = requirements.stats(user);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total", stats.total());
        body.put("byStatus", stats.byStatus());
        body.put("overdue", stats.overdue());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a requirement")
    public ResponseEntity<?> get(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.requirement(requirements.get(user, id)));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Edit a requirement before the supplier submits")
    public ResponseEntity<?> update(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody UpdateRequirementRequest body) {
        Requirement updated = requirements.update(user, id, new UpdateRequirementCommand(body.title,
                body.description, body.priority, body.dueDate, body.passingScore, body.minimumGrade,
                body.maxReportAgeDays));
        return ResponseEntity.ok(view(updated));
    }

    @GetMapping("/{id}/review")
    @Operation(summary = "Submitted response for review")
    public ResponseEntity<?> review(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        ReviewView review = reviews.reviewView(user, id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requirement", ApiViews.requirement(review.requirement()));
        body.put("response", ApiViews.response(review.response()));
        body.put("submission", ApiViews.submission(review.submission()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/approve")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Approve a submitted requirement")
    public ResponseEntity<?> approve(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                     @Valid @RequestBody(required = false) ReviewRequest body) {
        log.info("Approve request for requirement {} by {}", id, user.email());
        return ResponseEntity.ok(view(reviews.approve(user, id, command(body))));
    }

    @PostMapping("/{id}/reject")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Reject a submitted requirement", description = "A reason is required")
    public ResponseEntity<?> reject(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody ReviewRequest body) {
        log.info("Reject request for requirement {} by {}", id, user.email());
        return ResponseEntity.ok(view(reviews.reject(user, id, command(body))));
    }

    @PostMapping("/{id}/request-revision")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Send a submitted requirement back to the supplier", description = "A reason is required")
    public ResponseEntity<?> requestRevision(@AuthenticationPrincipal AuthenticatedUser user,
                                             @PathVariable("id") UUID id,
                                             @Valid @RequestBody ReviewRequest body) {
        log.info("Revision requested for requirement {} by {}", id, user.email());
        return ResponseEntity.ok(view(reviews.requestRevision(user, id, command(body))));
    }

    private Map<String, Object> view(Requirement requirement) {
        return ApiViews.requirement(RequirementView.of(requirement, OffsetDateTime.now(clock)));
    }

    private static ReviewCommand command(ReviewRequest body) {
        if (body == null) {
            return new ReviewCommand(null, null, null, null);
        }
        return new ReviewCommand(body.notes, body.reason, body.overrideScore, body.overrideGrade);
    }
}
