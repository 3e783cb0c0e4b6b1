package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.QuestionOption;
import com.nisfix.compliance.domain.questionnaire.QuestionType;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.requirement.RequirementType;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SupplierResponse;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionScorerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T09:00:00Z");

    private final SubmissionScorer scorer = new SubmissionScorer();
    private final Questionnaire questionnaire = Questionnaire.create(UUID.randomUUID(), "Security", null, 70,
            null, List.of(new Topic("access", "Access control", null, 0), new Topic("ops", "Operations", null, 0)),
            NOW);

    private Question yesNo(String topic, int points, boolean mustPass) {
        return Question.create(questionnaire.getId(), topic, "Question", null, null, QuestionType.YES_NO, 1, null,
                mustPass, List.of(new QuestionOption("yes", "Yes", points, true, 0),
                        new QuestionOption("no", "No", 0, false, 0)), NOW);
    }

    private Requirement requirement(Integer passingScore) {
        return Requirement.assign(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                RequirementType.QUESTIONNAIRE, "Security review", null, null, null, questionnaire.getId(),
                passingScore, null, null, UUID.randomUUID(), NOW);
    }

    private static AnswerInput answer(Question q, String option) {
        return new AnswerInput(q.getId(), List.of(option), null);
    }

    @Test
    void shouldFailWhenMustPassQuestionIsMissedDespiteHighScore() {
        Question gate = yesNo("access", 5, true);
        List<Question> questions = new ArrayList<>(List.of(gate));
        List<AnswerInput> answers = new ArrayList<>(List.of(answer(gate, "no")));
        for (int i = 0; i < 19; i++) {
            Question q = yesNo("ops", 5, false);
            questions.add(q);
            answers.add(answer(q, "yes"));
        }
        SupplierResponse response = SupplierResponse.open(UUID.randomUUID(), UUID.randomUUID(), NOW.minusMinutes(30));

        QuestionnaireSubmission s = scorer.score(requirement(null), questionnaire, questions, response, answers, NOW);

        assertThat(s.getPercentageScore()).isEqualTo(95.0);
        assertThat(s.isMustPassFailed()).isTrue();
        assertThat(s.isPassed()).isFalse();
        assertThat(s.getCompletionTimeMinutes()).isEqualTo(30);
    }

    @Test
    void shouldPassAtOrAboveThreshold() {
        List<Question> questions = new ArrayList<>();
        List<AnswerInput> answers = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Question q = yesNo(i < 5 ? "access" : "ops", 10, false);
            questions.add(q);
            answers.add(answer(q, i < 8 ? "yes" : "no"));
        }
        SupplierResponse response = SupplierResponse.open(UUID.randomUUID(), UUID.randomUUID(), NOW);

        QuestionnaireSubmission s = scorer.score(requirement(null), questionnaire, questions, response, answers, NOW);

        assertThat(s.getTotalScore()).isEqualTo(80);
        assertThat(s.getMaxPossibleScore()).isEqualTo(100);
        assertThat(s.getPassingScore()).isEqualTo(70);
        assertThat(s.isPassed()).isTrue();
        assertThat(s.getTopicScores()).hasSize(2);
        assertThat(s.getTopicScores().get(0).percentageScore()).isEqualTo(100.0);
        assertThat(s.getTopicScores().get(1).percentageScore()).isEqualTo(60.0);
    }

    @Test
    void shouldPreferRequirementPassingScore() {
        Question q = yesNo("access", 10, false);
        Question other = yesNo("access", 10, false);
        SupplierResponse response = SupplierResponse.open(UUID.randomUUID(), UUID.randomUUID(), NOW);

        QuestionnaireSubmission s = scorer.score(requirement(90), questionnaire, List.of(q, other), response,
                List.of(answer(q, "yes"), answer(other, "no")), NOW);

        assertThat(s.getPassingScore()).isEqualTo(90);
        assertThat(s.isPassed()).isFalse();
    }

    @Test
    void shouldIgnoreUnknownQuestionsAndCountOnlyAnswered() {
        Question answered = yesNo("access", 10, false);
        Question skipped = yesNo("ops", 10, false);
        SupplierResponse response = SupplierResponse.open(UUID.randomUUID(), UUID.randomUUID(), NOW);

        QuestionnaireSubmission s = scorer.score(requirement(null), questionnaire, List.of(answered, skipped),
                response, List.of(answer(answered, "yes"),
                        new AnswerInput(UUID.randomUUID(), List.of("yes"), null)), NOW);

        assertThat(s.getAnswers()).hasSize(1);
        assertThat(s.getMaxPossibleScore()).isEqualTo(10);
        assertThat(s.getPercentageScore()).isEqualTo(100.0);
        assertThat(s.getTopicScores()).extracting(t -> t.topicId()).containsExactly("access");
    }

    @Test
    void shouldReportZeroPercentWithoutAnswers() {
        assertThat(SubmissionScorer.percentage(0, 0)).isZero();
    }
}
