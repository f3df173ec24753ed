package com.flamingo.ai.studymind.domain.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** One question/answer pair of a flashcard deck. */
public record Flashcard(String question, String answer) {

  @JsonIgnore
  public boolean isComplete() {
    return question != null && !question.isBlank() && answer != null && !answer.isBlank();
  }
}
