package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.ports.ResponseRepository;
import com.nisfix.compliance.domain.requirement.ReportGrade;
import com.nisfix.compliance.domain.response.DocumentReport;
import com.nisfix.compliance.domain.response.DraftAnswer;
import com.nisfix.compliance.domain.response.SupplierResponse;
import com.nisfix.compliance.exception.ConcurrentUpdateException;
import com.nisfix.compliance.infrastructure.jpa.AnswerEmbeddable;
import com.nisfix.compliance.infrastructure.jpa.SpringSupplierResponseRepository;
import com.nisfix.compliance.infrastructure.jpa.SupplierResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaResponseRepositoryAdapter implements ResponseRepository {
    private final SpringSupplierResponseRepository responses;

    public JpaResponseRepositoryAdapter(SpringSupplierResponseRepository responses) {
        this.responses = responses;
    }

    @Override
    public SupplierResponse save(SupplierResponse r) {
        SupplierResponseEntity e = responses.findById(r.getId()).orElseGet(SupplierResponseEntity::new);
        if (e.getVersion() != null && e.getVersion() != r.getVersion()) {
            throw new ConcurrentUpdateException("response " + r.getId() + " was modified concurrently");
        }
        e.setId(r.getId());
        e.setRequirementId(r.getRequirementId());
        e.setSupplierId(r.getSupplierId());
        e.setSubmissionId(r.getSubmissionId());
        DocumentReport report = r.getDocumentReport();
        e.setReportGrade(report == null ? null : report.grade().name());
        e.setReportDate(report == null ? null : report.reportDate());
        e.setReportReference(report == null ? null : report.reference());
        e.setScore(r.getScore());
        e.setMaxScore(r.getMaxScore());
        e.setPassed(r.getPassed());
        e.setGrade(StatusHistoryMapper.name(r.getGrade()));
        e.getDraftAnswers().clear();
        for (DraftAnswer d : r.getDraftAnswers()) {
            AnswerEmbeddable a = new AnswerEmbeddable();
            a.setQuestionId(d.questionId());
            a.setSelectedOptions(new ArrayList<>(d.selectedOptions()));
            a.setTextAnswer(d.textAnswer());
            a.setSavedAt(d.savedAt());
            e.getDraftAnswers().add(a);
        }
        e.setReviewedByUserId(r.getReviewedByUserId());
        e.setReviewedAt(r.getReviewedAt());
        e.setReviewNotes(r.getReviewNotes());
        e.setOverrideScore(r.getOverrideScore());
        e.setOverrideGrade(StatusHistoryMapper.name(r.getOverrideGrade()));
        e.setStartedAt(r.getStartedAt());
        e.setSubmittedAt(r.getSubmittedAt());
        e.setCreatedAt(r.getCreatedAt());
        e.setUpdatedAt(r.getUpdatedAt());
        return toDomain(responses.saveAndFlush(e));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SupplierResponse> findById(UUID id) {
        return responses.findById(id).map(JpaResponseRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SupplierResponse> findLatestByRequirement(UUID requirementId) {
        return responses.findFirstByRequirementIdOrderByStartedAtDesc(requirementId)
                .map(JpaResponseRepositoryAdapter::toDomain);
    }

    private static SupplierResponse toDomain(SupplierResponseEntity e) {
        DocumentReport report = e.getReportGrade() == null ? null
                : new DocumentReport(ReportGrade.valueOf(e.getReportGrade()), e.getReportDate(), e.getReportReference());
        return new SupplierResponse(e.getId(), e.getRequirementId(), e.getSupplierId(), e.getSubmissionId(), report,
                e.getScore(), e.getMaxScore(), e.getPassed(),
                e.getGrade() == null ? null : ReportGrade.valueOf(e.getGrade()),
                e.getDraftAnswers().stream()
                        .map(a -> new DraftAnswer(a.getQuestionId(), a.getSelectedOptions(), a.getTextAnswer(),
                                a.getSavedAt()))
                        .toList(),
                e.getReviewedByUserId(), e.getReviewedAt(), e.getReviewNotes(), e.getOverrideScore(),
                e.getOverrideGrade() == null ? null : ReportGrade.valueOf(e.getOverrideGrade()),
                e.getStartedAt(), e.getSubmittedAt(), e.getCreatedAt(), e.getUpdatedAt(),
                e.getVersion() == null ? 0L : e.getVersion());
    }
}
