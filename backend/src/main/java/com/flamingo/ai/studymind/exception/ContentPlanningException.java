package com.flamingo.ai.studymind.exception;

/** Exception thrown when a creation request cannot be turned into a usable plan. */
public class ContentPlanningException extends RuntimeException {

  private final String userMessage;

  public ContentPlanningException(String message) {
    super(message);
    this.userMessage =
        "I could not work out what to create. Please be more specific about what you need.";
  }

  public ContentPlanningException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage =
        "I could not work out what to create. Please be more specific about what you need.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
