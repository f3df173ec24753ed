package com.flamingo.ai.studymind.exception;

import dev.langchain4j.exception.RateLimitException;

/** Exception thrown when the language model provider fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, cause instanceof RateLimitException);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
