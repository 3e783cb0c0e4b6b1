package com.nisfix.compliance.api;

import com.nisfix.compliance.api.dto.FromTemplateRequest;
import com.nisfix.compliance.api.dto.QuestionRequest;
import com.nisfix.compliance.api.dto.QuestionnaireRequest;
import com.nisfix.compliance.application.QuestionnaireService;
import com.nisfix.compliance.application.QuestionnaireService.QuestionCommand;
import com.nisfix.compliance.config.AuthenticatedUser;
import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.QuestionnaireStatus;
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

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Questionnaires", description = "Company questionnaires and their questions")
public class QuestionnaireController {

    private final QuestionnaireService questionnaires;

    public QuestionnaireController(QuestionnaireService questionnaires) {
        this.questionnaires = questionnaires;
    }

    @PostMapping("/questionnaires")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Create a draft questionnaire")
    public ResponseEntity<?> create(@AuthenticationPrincipal AuthenticatedUser user,
                                    @Validated(QuestionnaireRequest.Create.class) @RequestBody QuestionnaireRequest body) {
        Questionnaire created = questionnaires.create(user.organizationId(), body.name, body.description,
                body.passingScore, body.scoringMode, body.topics);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.questionnaire(created));
    }

    @PostMapping("/questionnaires/from-template")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Create a draft questionnaire from a template",
            description = "Copies the template's topics and default passing score")
    public ResponseEntity<?> createFromTemplate(@AuthenticationPrincipal AuthenticatedUser user,
                                                @Valid @RequestBody FromTemplateRequest body) {
        Questionnaire created = questionnaires.createFromTemplate(user.organizationId(), body.templateId, body.name);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.questionnaire(created));
    }

    @GetMapping("/questionnaires")
    @Operation(summary = "List questionnaires")
    public ResponseEntity<?> list(@AuthenticationPrincipal AuthenticatedUser user,
                                  @RequestParam(required = false) QuestionnaireStatus status,
                                  @RequestParam(defaultValue = "1") int page,
                                  @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiViews.page(
                questionnaires.list(user.organizationId(), status, PageQuery.of(page, limit)),
                ApiViews::questionnaire));
    }

    @GetMapping("/questionnaires/{id}")
    @Operation(summary = "Get a questionnaire with its questions")
    public ResponseEntity<?> get(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        Map<String, Object> body = ApiViews.questionnaire(questionnaires.get(user.organizationId(), id));
        List<Question> questions = questionnaires.listQuestions(user.organizationId(), id);
        body.put("questions", questions.stream().map(ApiViews::question).toList());
        return ResponseEntity.ok(body);
    }

    @PatchMapping("/questionnaires/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update a draft questionnaire")
    public ResponseEntity<?> update(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                    @Valid @RequestBody QuestionnaireRequest body) {
        return ResponseEntity.ok(ApiViews.questionnaire(questionnaires.update(user.organizationId(), id,
                body.name, body.description, body.passingScore, body.scoringMode, body.topics)));
    }

    @DeleteMapping("/questionnaires/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Delete a draft questionnaire")
    public ResponseEntity<?> delete(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        questionnaires.delete(user.organizationId(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/questionnaires/{id}/publish")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Publish a questionnaire", description = "Requires at least one question")
    public ResponseEntity<?> publish(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.questionnaire(questionnaires.publish(user.organizationId(), id)));
    }

    @PostMapping("/questionnaires/{id}/archive")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Archive a published questionnaire")
    public ResponseEntity<?> archive(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiViews.questionnaire(questionnaires.archive(user.organizationId(), id)));
    }

    @PostMapping("/questionnaires/{id}/questions")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Add a question to a draft questionnaire")
    public ResponseEntity<?> addQuestion(@AuthenticationPrincipal AuthenticatedUser user, @PathVariable("id") UUID id,
                                         @Validated(QuestionnaireRequest.Create.class) @RequestBody QuestionRequest body) {
        Question created = questionnaires.addQuestion(user.organizationId(), id, command(body));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.question(created));
    }

    @PatchMapping("/questions/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Update a question of a draft questionnaire")
    public ResponseEntity<?> updateQuestion(@AuthenticationPrincipal AuthenticatedUser user,
                                            @PathVariable("id") UUID id,
                                            @Valid @RequestBody QuestionRequest body) {
        return ResponseEntity.ok(ApiViews.question(
                questionnaires.updateQuestion(user.organizationId(), id, command(body))));
    }

    @DeleteMapping("/questions/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Delete a question of a draft questionnaire")
    public ResponseEntity<?> deleteQuestion(@AuthenticationPrincipal AuthenticatedUser user,
                                            @PathVariable("id") UUID id) {
        questionnaires.deleteQuestion(user.organizationId(), id);
        return ResponseEntity.noContent().build();
    }

    private static QuestionCommand command(QuestionRequest body) {
        return new QuestionCommand(body.topicId, body.text, body.description, body.helpText, body.type,
                body.order, body.weight, body.mustPass, body.options);
    }
}
