package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.ports.SubmissionRepository;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SubmissionAnswer;
import com.nisfix.compliance.domain.response.TopicScore;
import com.nisfix.compliance.infrastructure.jpa.AnswerEmbeddable;
import com.nisfix.compliance.infrastructure.jpa.QuestionnaireSubmissionEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringSubmissionRepository;
import com.nisfix.compliance.infrastructure.jpa.TopicScoreEmbeddable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaSubmissionRepositoryAdapter implements SubmissionRepository {
    private final SpringSubmissionRepository submissions;

    public JpaSubmissionRepositoryAdapter(SpringSubmissionRepository submissions) {
        this.submissions = submissions;
    }

    @Override
    public QuestionnaireSubmission save(QuestionnaireSubmission s) {
        QuestionnaireSubmissionEntity e = new QuestionnaireSubmissionEntity();
        e.setId(s.getId());
        e.setResponseId(s.getResponseId());
        e.setRequirementId(s.getRequirementId());
        e.setQuestionnaireId(s.getQuestionnaireId());
        e.setSupplierId(s.getSupplierId());
        for (SubmissionAnswer answer : s.getAnswers()) {
            AnswerEmbeddable a = new AnswerEmbeddable();
            a.setQuestionId(answer.questionId());
            a.setSelectedOptions(new ArrayList<>(answer.selectedOptions()));
            a.setTextAnswer(answer.textAnswer());
            a.setPointsEarned(answer.pointsEarned());
            a.setMaxPoints(answer.maxPoints());
            a.setMustPassMet(answer.mustPassMet());
            e.getAnswers().add(a);
        }
        e.setTotalScore(s.getTotalScore());
        e.setMaxPossibleScore(s.getMaxPossibleScore());
        e.setPercentageScore(s.getPercentageScore());
        e.setPassingScore(s.getPassingScore());
        e.setPassed(s.isPassed());
        e.setMustPassFailed(s.isMustPassFailed());
        for (TopicScore t : s.getTopicScores()) {
            e.getTopicScores().add(new TopicScoreEmbeddable(t.topicId(), t.topicName(), t.score(), t.maxScore(),
                    t.percentageScore()));
        }
        e.setCompletionTimeMinutes(s.getCompletionTimeMinutes());
        e.setStartedAt(s.getStartedAt());
        e.setSubmittedAt(s.getSubmittedAt());
        submissions.save(e);
        return s;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QuestionnaireSubmission> findById(UUID id) {
        return submissions.findById(id).map(JpaSubmissionRepositoryAdapter::toDomain);
    }

    private static QuestionnaireSubmission toDomain(QuestionnaireSubmissionEntity e) {
        return new QuestionnaireSubmission(e.getId(), e.getResponseId(), e.getRequirementId(),
                e.getQuestionnaireId(), e.getSupplierId(),
                e.getAnswers().stream()
                        .map(a -> new SubmissionAnswer(a.getQuestionId(), a.getSelectedOptions(), a.getTextAnswer(),
                                a.getPointsEarned() == null ? 0 : a.getPointsEarned(),
                                a.getMaxPoints() == null ? 0 : a.getMaxPoints(), a.getMustPassMet()))
                        .toList(),
                e.getTotalScore(), e.getMaxPossibleScore(), e.getPercentageScore(), e.getPassingScore(),
                e.isPassed(), e.isMustPassFailed(),
                e.getTopicScores().stream()
                        .map(t -> new TopicScore(t.getTopicId(), t.getTopicName(), t.getScore(), t.getMaxScore(),
                                t.getPercentageScore()))
                        .toList(),
                e.getCompletionTimeMinutes(), e.getStartedAt(), e.getSubmittedAt());
    }
}
