package com.flamingo.ai.studymind.exception;

import java.util.UUID;

/** Exception thrown when a chat session does not exist for the caller. */
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionUid;

  public SessionNotFoundException(UUID sessionUid) {
    super("Session not found: " + sessionUid);
    this.sessionUid = sessionUid;
  }

  public UUID getSessionUid() {
    return sessionUid;
  }
}
