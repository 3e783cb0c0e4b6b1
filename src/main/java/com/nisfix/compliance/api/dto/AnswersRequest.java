package com.nisfix.compliance.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public class AnswersRequest {
  @NotNull @Valid public List<Answer> answers;

  public static class Answer {
    @NotNull public UUID questionId;
    public List<String> selectedOptions;
    public String textAnswer;
  }
}
