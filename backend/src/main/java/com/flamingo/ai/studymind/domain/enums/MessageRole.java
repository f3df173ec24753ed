package com.flamingo.ai.studymind.domain.enums;

/** Defines the role of a chat turn speaker. */
public enum MessageRole {
  /** Turn written by the user. */
  USER,

  /** Turn produced by the assistant. */
  ASSISTANT
}
