package com.nisfix.compliance.domain.response;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Work-in-progress answer kept on an open response. One per question, the latest save wins.
 */
public record DraftAnswer(UUID questionId, List<String> selectedOptions, String textAnswer, OffsetDateTime savedAt) {

    public DraftAnswer {
        selectedOptions = selectedOptions == null ? List.of() : List.copyOf(selectedOptions);
    }
}
