package com.flamingo.ai.studymind.domain.enums;

/** Category of a user's chat request. */
public enum Intent {
  /** Plain conversation, no content action. */
  CONVERSE,

  /** Produce new library content. */
  CREATE,

  /** Analyze existing library content. */
  READ,

  /** Modify existing content (not supported yet). */
  UPDATE,

  /** Remove existing content (not supported yet). */
  DELETE
}
