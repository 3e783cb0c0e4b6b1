package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.PageQuery;
import com.nisfix.compliance.domain.PageResult;
import com.nisfix.compliance.domain.questionnaire.Questionnaire;
import com.nisfix.compliance.domain.questionnaire.QuestionnaireStatus;

import java.util.Optional;
import java.util.UUID;

public interface QuestionnaireRepository {
    Questionnaire save(Questionnaire questionnaire);

    Optional<Questionnaire> findById(UUID id);

    PageResult<Questionnaire> listByCompany(UUID companyId, QuestionnaireStatus status, PageQuery page);

    void delete(UUID id);
}
