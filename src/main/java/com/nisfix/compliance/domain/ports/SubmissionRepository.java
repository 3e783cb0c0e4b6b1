package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.response.QuestionnaireSubmission;

import java.util.Optional;
import java.util.UUID;

public interface SubmissionRepository {
    QuestionnaireSubmission save(QuestionnaireSubmission submission);

    Optional<QuestionnaireSubmission> findById(UUID id);
}
