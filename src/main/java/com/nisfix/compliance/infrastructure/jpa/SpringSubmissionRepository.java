package com.nisfix.compliance.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface SpringSubmissionRepository extends JpaRepository<QuestionnaireSubmissionEntity, UUID> {
}
