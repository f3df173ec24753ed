package com.flamingo.ai.studymind.exception;

/** Exception thrown when no valid intent can be derived from the user's message. */
public class IntentClassificationException extends RuntimeException {

  private final String userMessage;

  public IntentClassificationException(String message) {
    super(message);
    this.userMessage =
        "I could not tell what you would like me to do. Please clarify your request.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
