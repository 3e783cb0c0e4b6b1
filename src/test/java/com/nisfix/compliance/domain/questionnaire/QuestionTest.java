package com.nisfix.compliance.domain.questionnaire;

import com.nisfix.compliance.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T09:00:00Z");

    private static Question question(QuestionType type, List<QuestionOption> options) {
        return Question.create(UUID.randomUUID(), null, "Do you encrypt data at rest?", null, null,
                type, 1, null, false, options, NOW);
    }

    @Test
    void shouldUseBestOptionAsMaxForSingleChoice() {
        Question q = question(QuestionType.SINGLE_CHOICE, List.of(
                new QuestionOption("a", "Always", 10, true, 0),
                new QuestionOption("b", "Sometimes", 4, false, 0)));

        assertThat(q.getMaxPoints()).isEqualTo(10);
        assertThat(q.score(List.of("b"), null)).isEqualTo(4);
        assertThat(q.score(List.of("a", "b"), null)).isZero();
        assertThat(q.getOptions()).extracting(QuestionOption::order).containsExactly(1, 2);
    }

    @Test
    void shouldSumCorrectOptionsForMultipleChoice() {
        Question q = question(QuestionType.MULTIPLE_CHOICE, List.of(
                new QuestionOption("mfa", "MFA", 5, true, 0),
                new QuestionOption("sso", "SSO", 3, true, 0),
                new QuestionOption("none", "None", 2, false, 0)));

        assertThat(q.getMaxPoints()).isEqualTo(8);
        assertThat(q.score(List.of("mfa", "none"), null)).isEqualTo(5);
    }

    @Test
    void shouldAwardFullPointsForNonBlankText() {
        Question q = question(QuestionType.TEXT, null);

        assertThat(q.getMaxPoints()).isEqualTo(1);
        assertThat(q.score(null, "We use AES-256")).isEqualTo(1);
        assertThat(q.score(null, "  ")).isZero();
    }

    @Test
    void shouldRequireOptionsForChoiceQuestions() {
        assertThatThrownBy(() -> question(QuestionType.SINGLE_CHOICE, List.of()))
                .isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> question(QuestionType.MULTIPLE_CHOICE, List.of(
                new QuestionOption("x", "X", 1, true, 0),
                new QuestionOption("x", "Y", 1, true, 0))))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessageContaining("duplicate option id");
    }

    @Test
    void shouldValidateAnswerShape() {
        Question q = question(QuestionType.SINGLE_CHOICE, List.of(new QuestionOption("a", "Yes", 1, true, 0)));

        assertThatThrownBy(() -> q.validateAnswer(List.of(), null))
                .isInstanceOf(ValidationFailedException.class);
        assertThatThrownBy(() -> q.validateAnswer(List.of("zzz"), null))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessageContaining("unknown option");
        q.validateAnswer(List.of("a"), null);
    }
}
