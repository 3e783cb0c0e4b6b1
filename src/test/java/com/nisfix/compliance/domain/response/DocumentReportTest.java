package com.nisfix.compliance.domain.response;

import com.nisfix.compliance.domain.requirement.ReportGrade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentReportTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Test
    @DisplayName("Report at or above the minimum grade and within the age limit passes")
    void shouldPassWhenGradeAndAgeAreWithinLimits() {
        DocumentReport report = new DocumentReport(ReportGrade.B, TODAY.minusDays(90), "RPT-1");

        assertThat(report.satisfies(ReportGrade.C, 90, TODAY)).isTrue();
        assertThat(report.satisfies(ReportGrade.B, 90, TODAY)).isTrue();
    }

    @Test
    void shouldFailWhenGradeBelowMinimum() {
        DocumentReport report = new DocumentReport(ReportGrade.D, TODAY, "RPT-2");

        assertThat(report.satisfies(ReportGrade.C, 90, TODAY)).isFalse();
    }

    @Test
    void shouldFailWhenReportTooOld() {
        DocumentReport report = new DocumentReport(ReportGrade.A, TODAY.minusDays(91), "RPT-3");

        assertThat(report.ageInDays(TODAY)).isEqualTo(91);
        assertThat(report.satisfies(ReportGrade.C, 90, TODAY)).isFalse();
    }

    @Test
    void shouldFailWhenReportDatedInTheFuture() {
        DocumentReport report = new DocumentReport(ReportGrade.A, TODAY.plusDays(1), "RPT-4");

        assertThat(report.satisfies(ReportGrade.F, 365, TODAY)).isFalse();
    }
}
