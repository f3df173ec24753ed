package com.flamingo.ai.studymind.service.orchestrator;

import java.util.UUID;

/** Runs one chat request through the pipeline. */
public interface ChatOrchestrator {

  /**
   * Handles a user message. Either every write of the run is committed or none is.
   *
   * @param userId the caller
   * @param sessionUid client-chosen session id; the session is created on first use
   * @param message the user message, inline markers included
   * @return the persisted session, the reply and the items created by this run
   */
  ChatExchange handle(Long userId, UUID sessionUid, String message);
}
