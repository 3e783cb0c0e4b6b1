package com.nisfix.compliance.domain.response;

import com.nisfix.compliance.domain.requirement.ReportGrade;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Security report a supplier hands in for a document requirement.
 */
public record DocumentReport(ReportGrade grade, LocalDate reportDate, String reference) {

    public long ageInDays(LocalDate today) {
        return ChronoUnit.DAYS.between(reportDate, today);
    }

    /**
     * A report passes when its grade meets the minimum and it is not older than the allowed age.
     * Reports dated in the future never pass.
     */
    public boolean satisfies(ReportGrade minimumGrade, int maxReportAgeDays, LocalDate today) {
        long age = ageInDays(today);
        return grade.meetsMinimum(minimumGrade) && age >= 0 && age <= maxReportAgeDays;
    }
}
