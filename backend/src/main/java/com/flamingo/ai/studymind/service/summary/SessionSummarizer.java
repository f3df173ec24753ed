package com.flamingo.ai.studymind.service.summary;

import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import java.util.List;

/** Condenses the recent conversation into a rolling digest. */
public interface SessionSummarizer {

  /**
   * Summarizes the trailing window of prior turns.
   *
   * <p>Every marker literal found in the window appears verbatim in the result, and no marker that
   * is absent from the window does.
   *
   * @param priorTurns all prior turns of the session, oldest first
   * @return the digest, empty when there is no history
   */
  String summarize(List<ChatTurn> priorTurns);
}
