package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.domain.requirement.Requirement;
import com.nisfix.compliance.domain.response.QuestionnaireSubmission;
import com.nisfix.compliance.domain.response.SubmissionAnswer;
import com.nisfix.compliance.domain.response.SupplierResponse;
import com.nisfix.compliance.domain.response.TopicScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a set of answers into a scored submission.
 *
 * <p>Only answered questions count towards the maximum score. Answers to questions that are not
 * part of the questionnaire are ignored. A single unmet must-pass question fails the whole
 * submission regardless of its percentage.
 */
@Component
public class SubmissionScorer {

    private static final Logger log = LoggerFactory.getLogger(SubmissionScorer.class);

    public QuestionnaireSubmission score(Requirement requirement, Questionnaire questionnaire, List<Question> questions,
                                         SupplierResponse response, List<AnswerInput> answers, OffsetDateTime now) {
        Map<UUID, Question> byId = questions.stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));

        Map<String, int[]> topicTotals = new LinkedHashMap<>();
        for (Topic topic : questionnaire.getTopics()) {
            topicTotals.put(topic.id(), new int[2]);
        }

        List<SubmissionAnswer> scored = new ArrayList<>();
        int total = 0;
        int max = 0;
        boolean mustPassFailed = false;
        for (AnswerInput answer : answers) {
            Question question = byId.get(answer.questionId());
            if (question == null) {
                log.debug("Ignoring answer to unknown question {}", answer.questionId());
                continue;
            }
            int earned = question.score(answer.selectedOptions(), answer.textAnswer());
            Boolean mustPassMet = question.isMustPass() ? earned >= question.getMaxPoints() : null;
            SubmissionAnswer submissionAnswer = new SubmissionAnswer(question.getId(), answer.selectedOptions(),
                    answer.textAnswer(), earned, question.getMaxPoints(), mustPassMet);
            scored.add(submissionAnswer);

            total += earned;
            max += question.getMaxPoints();
            mustPassFailed |= submissionAnswer.failsMustPass();

            int[] topic = question.getTopicId() == null ? null : topicTotals.get(question.getTopicId());
            if (topic != null) {
                topic[0] += earned;
                topic[1] += question.getMaxPoints();
            }
        }

        List<TopicScore> topicScores = new ArrayList<>();
        for (Topic topic : questionnaire.getTopics()) {
            int[] t = topicTotals.get(topic.id());
            if (t[1] > 0) {
                topicScores.add(new TopicScore(topic.id(), topic.name(), t[0], t[1], percentage(t[0], t[1])));
            }
        }

        int passingScore = requirement.getPassingScore() != null
                ? requirement.getPassingScore() : questionnaire.getPassingScore();
        double pct = percentage(total, max);
        boolean passed = !mustPassFailed && pct >= passingScore;

        log.info("Scored response {} for requirement {}: {}/{} ({}%), passing {}, mustPassFailed {} -> passed {}",
                response.getId(), requirement.getId(), total, max, pct, passingScore, mustPassFailed, passed);

        return new QuestionnaireSubmission(UUID.randomUUID(), response.getId(), requirement.getId(),
                questionnaire.getId(), response.getSupplierId(), scored, total, max, pct, passingScore, passed,
                mustPassFailed, topicScores, response.completionTimeMinutes(now), response.getStartedAt(), now);
    }

    static double percentage(int score, int max) {
        return max == 0 ? 0.0 : (double) score / max * 100;
    }
}
