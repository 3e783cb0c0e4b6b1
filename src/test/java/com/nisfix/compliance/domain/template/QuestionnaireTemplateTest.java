package com.nisfix.compliance.domain.template;

import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.QuestionnaireStatus;
import com.nisfix.compliance.domain.questionnaire.ScoringMode;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.exception.CannotModifyException;
import com.nisfix.compliance.exception.InvalidTransitionException;
import com.nisfix.compliance.exception.NotEditableException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionnaireTemplateTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 10, 9, 0, 0, 0, ZoneOffset.UTC);

    private final UUID owner = UUID.randomUUID();
    private final UUID other = UUID.randomUUID();

    private QuestionnaireTemplate draft(List<Topic> topics) {
        return QuestionnaireTemplate.draft(owner, UUID.randomUUID(), " Vendor baseline ", null, null, null,
                null, null, topics, List.of("vendor"), NOW);
    }

    private QuestionnaireTemplate withUsage(QuestionnaireTemplate t, int usage) {
        return new QuestionnaireTemplate(t.getId(), t.getName(), t.getDescription(), t.getCategory(),
                t.getVersion(), t.isSystem(), t.getOwnerOrganizationId(), t.getCreatedBy(), t.getVisibility(),
                t.getDefaultPassingScore(), t.getEstimatedMinutes(), t.getTopics(), t.getTags(), usage,
                t.getCreatedAt(), t.getUpdatedAt(), t.getPublishedAt());
    }

    @Test
    void shouldApplyDefaultsToNewDraft() {
        QuestionnaireTemplate template = draft(List.of(new Topic(null, "Access", null, 0)));

        assertThat(template.getName()).isEqualTo("Vendor baseline");
        assertThat(template.getCategory()).isEqualTo(TemplateCategory.CUSTOM);
        assertThat(template.getVisibility()).isEqualTo(TemplateVisibility.DRAFT);
        assertThat(template.getDefaultPassingScore()).isEqualTo(70);
        assertThat(template.getEstimatedMinutes()).isEqualTo(30);
        assertThat(template.getVersion()).isEqualTo("1.0");
        assertThat(template.getTopics()).singleElement().satisfies(t -> {
            assertThat(t.id()).isNotBlank();
            assertThat(t.order()).isEqualTo(1);
        });
    }

    @Test
    void shouldReserveSystemCategories() {
        assertThatThrownBy(() -> QuestionnaireTemplate.draft(owner, UUID.randomUUID(), "Mine", null,
                TemplateCategory.NIS2, null, null, null, List.of(), List.of(), NOW))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void shouldRejectDuplicateTopicIds() {
        assertThatThrownBy(() -> draft(List.of(new Topic("a", "One", null, 1), new Topic("a", "Two", null, 2))))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessageContaining("duplicate topic id a");
    }

    @Test
    void shouldNeedTopicsAndDraftStateToPublish() {
        QuestionnaireTemplate empty = draft(List.of());
        assertThatThrownBy(() -> empty.publish(TemplateVisibility.LOCAL, NOW))
                .isInstanceOf(ValidationFailedException.class);

        QuestionnaireTemplate template = draft(List.of(new Topic("access", "Access", null, 1)));
        assertThatThrownBy(() -> template.publish(TemplateVisibility.DRAFT, NOW))
                .isInstanceOf(ValidationFailedException.class);

        template.publish(TemplateVisibility.LOCAL, NOW);
        assertThat(template.getPublishedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> template.publish(TemplateVisibility.GLOBAL, NOW))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> template.update("Renamed", null, null, null, null, null, null, NOW))
                .isInstanceOf(NotEditableException.class);
    }

    @Test
    void shouldLimitVisibilityOfCompanyTemplates() {
        QuestionnaireTemplate template = draft(List.of(new Topic("access", "Access", null, 1)));
        assertThat(template.isVisibleTo(owner)).isTrue();
        assertThat(template.isVisibleTo(other)).isFalse();

        template.publish(TemplateVisibility.LOCAL, NOW);
        assertThat(template.isVisibleTo(other)).isFalse();

        template.unpublish(NOW);
        template.publish(TemplateVisibility.GLOBAL, NOW);
        assertThat(template.isVisibleTo(other)).isTrue();
        assertThat(template.isUsableBy(other)).isTrue();
    }

    @Test
    void shouldProtectTemplatesInUse() {
        QuestionnaireTemplate template = draft(List.of(new Topic("access", "Access", null, 1)));
        template.publish(TemplateVisibility.GLOBAL, NOW);
        QuestionnaireTemplate used = withUsage(template, 2);

        assertThatThrownBy(used::requireDeletable).isInstanceOf(CannotModifyException.class);
        assertThatThrownBy(() -> used.unpublish(NOW)).isInstanceOf(CannotModifyException.class);
    }

    @Test
    void shouldKeepSystemTemplatesReadOnly() {
        QuestionnaireTemplate system = QuestionnaireTemplate.system("NIS2 Quick Readiness Check", null,
                TemplateCategory.NIS2, "1.0", 70, 30, List.of(new Topic("governance", "Governance", null, 1)),
                List.of("nis2"), NOW);

        assertThat(system.isVisibleTo(other)).isTrue();
        assertThat(system.getVisibility()).isEqualTo(TemplateVisibility.GLOBAL);
        assertThatThrownBy(system::requireEditable).isInstanceOf(NotEditableException.class);
        assertThatThrownBy(system::requireDeletable).isInstanceOf(CannotModifyException.class);
        assertThatThrownBy(() -> system.unpublish(NOW)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void shouldCopyTopicsAndPassingScoreIntoQuestionnaire() {
        QuestionnaireTemplate gdpr = QuestionnaireTemplate.system("GDPR Compliance Checklist", "GDPR checks",
                TemplateCategory.GDPR, "1.0", 80, 60,
                List.of(new Topic("lawful-basis", "Lawful Basis", null, 1), new Topic("dpia", "DPIA", null, 2)),
                List.of(), NOW);

        Questionnaire questionnaire = Questionnaire.fromTemplate(owner, gdpr, null, NOW);

        assertThat(questionnaire.getTemplateId()).isEqualTo(gdpr.getId());
        assertThat(questionnaire.getName()).isEqualTo("GDPR Compliance Checklist");
        assertThat(questionnaire.getDescription()).isEqualTo("GDPR checks");
        assertThat(questionnaire.getPassingScore()).isEqualTo(80);
        assertThat(questionnaire.getScoringMode()).isEqualTo(ScoringMode.PERCENTAGE);
        assertThat(questionnaire.getStatus()).isEqualTo(QuestionnaireStatus.DRAFT);
        assertThat(questionnaire.getTopics()).extracting(Topic::id).containsExactly("lawful-basis", "dpia");
    }
}
