package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.ports.QuestionRepository;
import com.nisfix.compliance.domain.ports.QuestionnaireRepository;
import com.nisfix.compliance.domain.ports.TemplateRepository;
import com.nisfix.compliance.domain.questionnaire.Question;
import com.nisfix.compliance.domain.questionnaire.QuestionOption;
import com.nisfix.compliance.domain.questionnaire.QuestionType;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.QuestionnaireStatus;
import com.nisfix.compliance.domain.questionnaire.ScoringMode;
import com.nisfix.compliance.domain.questionnaire.Topic;
import com.nisfix.compliance.domain.template.QuestionnaireTemplate;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Questionnaire authoring. Questions can only change while their questionnaire is a draft, and
 * every change refreshes the questionnaire's question count and maximum score.
 */
@Service
public class QuestionnaireService {

    private static final Logger log = LoggerFactory.getLogger(QuestionnaireService.class);

    private final QuestionnaireRepository questionnaires;
    private final QuestionRepository questions;
    private final TemplateRepository templates;
    private final Clock clock;

    public QuestionnaireService(QuestionnaireRepository questionnaires, QuestionRepository questions,
                                TemplateRepository templates, Clock clock) {
        this.questionnaires = questionnaires;
        this.questions = questions;
        this.templates = templates;
        this.clock = clock;
    }

    @Transactional
    public Questionnaire create(UUID companyId, String name, String description, Integer passingScore,
                                ScoringMode scoringMode, List<Topic> topics) {
        Questionnaire questionnaire = questionnaires.save(Questionnaire.create(companyId, name.trim(), description,
                passingScore, scoringMode, topics, OffsetDateTime.now(clock)));
        log.info("Created questionnaire {} for company {}", questionnaire.getId(), companyId);
        return questionnaire;
    }

    /**
     * Starts a draft questionnaire from a template the company can use and counts the use on the
     * template. Without a name the template's name is taken.
     */
    @Transactional
    public Questionnaire createFromTemplate(UUID companyId, UUID templateId, String name) {
        QuestionnaireTemplate template = templates.findById(templateId)
                .filter(t -> t.isUsableBy(companyId))
                .orElseThrow(() -> new NotFoundException("Template", templateId));
        Questionnaire questionnaire = questionnaires.save(
                Questionnaire.fromTemplate(companyId, template, name, OffsetDateTime.now(clock)));
        templates.incrementUsage(templateId);
        log.info("Created questionnaire {} for company {} from template {}", questionnaire.getId(), companyId,
                templateId);
        return questionnaire;
    }

    @Transactional(readOnly = true)
    public Questionnaire get(UUID companyId, UUID questionnaireId) {
        return questionnaires.findById(questionnaireId)
                .filter(q -> q.getCompanyId().equals(companyId))
                .orElseThrow(() -> new NotFoundException("Questionnaire", questionnaireId));
    }

    @Transactional(readOnly = true)
    public List<Question> listQuestions(UUID companyId, UUID questionnaireId) {
        get(companyId, questionnaireId);
        return questions.listByQuestionnaire(questionnaireId);
    }

    @Transactional(readOnly = true)
    public PageResult<Questionnaire> list(UUID companyId, QuestionnaireStatus status, PageQuery page) {
        return questionnaires.listByCompany(companyId, status, page);
    }

    @Transactional
    public Questionnaire update(UUID companyId, UUID questionnaireId, String name, String description,
                                Integer passingScore, ScoringMode scoringMode, List<Topic> topics) {
        Questionnaire questionnaire = get(companyId, questionnaireId);
        questionnaire.update(name, description, passingScore, scoringMode, topics, OffsetDateTime.now(clock));
        return questionnaires.save(questionnaire);
    }

    @Transactional
    public void delete(UUID companyId, UUID questionnaireId) {
        Questionnaire questionnaire = get(companyId, questionnaireId);
        questionnaire.requireEditable();
        questions.deleteByQuestionnaire(questionnaireId);
        questionnaires.delete(questionnaireId);
        log.info("Deleted questionnaire {} of company {}", questionnaireId, companyId);
    }

    @Transactional
    public Questionnaire publish(UUID companyId, UUID questionnaireId) {
        Questionnaire questionnaire = get(companyId, questionnaireId);
        questionnaire.publish(OffsetDateTime.now(clock));
        log.info("Published questionnaire {} with {} questions", questionnaireId, questionnaire.getQuestionCount());
        return questionnaires.save(questionnaire);
    }

    @Transactional
    public Questionnaire archive(UUID companyId, UUID questionnaireId) {
        Questionnaire questionnaire = get(companyId, questionnaireId);
        questionnaire.archive(OffsetDateTime.now(clock));
        log.info("Archived questionnaire {}", questionnaireId);
        return questionnaires.save(questionnaire);
    }

    @Transactional
    public Question addQuestion(UUID companyId, UUID questionnaireId, QuestionCommand cmd) {
        Questionnaire questionnaire = get(companyId, questionnaireId);
        questionnaire.requireEditable();
        requireKnownTopic(questionnaire, cmd.topicId());

        int order = cmd.order() != null ? cmd.order() : questions.listByQuestionnaire(questionnaireId).size() + 1;
        Question question = questions.save(Question.create(questionnaireId, cmd.topicId(), cmd.text(),
                cmd.description(), cmd.helpText(), cmd.type(), order, cmd.weight(),
                Boolean.TRUE.equals(cmd.mustPass()), cmd.options(), OffsetDateTime.now(clock)));
        refreshStatistics(questionnaire);
        log.info("Added question {} to questionnaire {}", question.getId(), questionnaireId);
        return question;
    }

    @Transactional
    public Question updateQuestion(UUID companyId, UUID questionId, QuestionCommand cmd) {
        Question question = loadQuestion(questionId);
        Questionnaire questionnaire = get(companyId, question.getQuestionnaireId());
        questionnaire.requireEditable();
        requireKnownTopic(questionnaire, cmd.topicId());

        question.update(cmd.topicId(), cmd.text(), cmd.description(), cmd.helpText(), cmd.type(), cmd.order(),
                cmd.weight(), cmd.mustPass(), cmd.options(), OffsetDateTime.now(clock));
        Question saved = questions.save(question);
        refreshStatistics(questionnaire);
        return saved;
    }

    @Transactional
    public void deleteQuestion(UUID companyId, UUID questionId) {
        Question question = loadQuestion(questionId);
        Questionnaire questionnaire = get(companyId, question.getQuestionnaireId());
        questionnaire.requireEditable();
        questions.delete(questionId);
        refreshStatistics(questionnaire);
        log.info("Deleted question {} from questionnaire {}", questionId, questionnaire.getId());
    }

    private Question loadQuestion(UUID questionId) {
        return questions.findById(questionId)
                .orElseThrow(() -> new NotFoundException("Question", questionId));
    }

    private static void requireKnownTopic(Questionnaire questionnaire, String topicId) {
        if (topicId != null && questionnaire.findTopic(topicId).isEmpty()) {
            throw new ValidationFailedException("unknown topic: " + topicId);
        }
    }

    private void refreshStatistics(Questionnaire questionnaire) {
        List<Question> all = questions.listByQuestionnaire(questionnaire.getId());
        int max = all.stream().mapToInt(Question::getMaxPoints).sum();
        questionnaire.updateStatistics(all.size(), max, OffsetDateTime.now(clock));
        questionnaires.save(questionnaire);
    }

    /** Null fields keep the current value on update. */
    public record QuestionCommand(String topicId, String text, String description, String helpText,
                                  QuestionType type, Integer order, Integer weight, Boolean mustPass,
                                  List<QuestionOption> options) {}
}
