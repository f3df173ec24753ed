package com.flamingo.ai.studymind.exception;

/** Exception thrown for operations the assistant deliberately does not support yet. */
public class UnsupportedContentException extends RuntimeException {

  private final String feature;

  public UnsupportedContentException(String feature) {
    super(feature + " is not supported yet");
    this.feature = feature;
  }

  public String getFeature() {
    return feature;
  }

  public String getUserMessage() {
    return feature + " is not supported yet. Please try something else.";
  }
}
