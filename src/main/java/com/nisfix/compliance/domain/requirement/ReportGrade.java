package com.nisfix.compliance.domain.requirement;

/**
 * Grade of a security report, A best, F worst.
 */
public enum ReportGrade {
    A(5),
    B(4),
    C(3),
    D(2),
    F(1);

    private final int score;

    ReportGrade(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    public boolean meetsMinimum(ReportGrade minimum) {
        return score >= minimum.score;
    }
}
