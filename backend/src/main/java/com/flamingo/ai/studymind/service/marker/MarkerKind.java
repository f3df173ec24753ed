package com.flamingo.ai.studymind.service.marker;

/** The two inline reference markers that can appear in chat messages. */
public enum MarkerKind {
  /** Written by the user to point at an existing library item. */
  MENTION("mention"),

  /** Appended by the assistant to point at an item it created. */
  CREATED("created");

  private final String keyword;

  MarkerKind(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  static MarkerKind fromKeyword(String keyword) {
    return "created".equals(keyword) ? CREATED : MENTION;
  }
}
