package com.nisfix.compliance.application;

import java.util.List;
import java.util.UUID;

/** A supplier's answer to one question, as sent for a draft save or a submission. */
public record AnswerInput(UUID questionId, List<String> selectedOptions, String textAnswer) {

    public AnswerInput {
        selectedOptions = selectedOptions == null ? List.of() : List.copyOf(selectedOptions);
    }
}
