package com.nisfix.compliance.domain.response;

import java.util.List;
import java.util.UUID;

/**
 * A scored answer. {@code mustPassMet} is null for questions that are not must-pass.
 */
public record SubmissionAnswer(UUID questionId,
                               List<String> selectedOptions,
                               String textAnswer,
                               int pointsEarned,
                               int maxPoints,
                               Boolean mustPassMet) {

    public SubmissionAnswer {
        selectedOptions = selectedOptions == null ? List.of() : List.copyOf(selectedOptions);
    }

    public boolean failsMustPass() {
        return mustPassMet != null && !mustPassMet;
    }
}
