package com.flamingo.ai.studymind.service.reference;

import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import java.util.List;

/** Turns the inline markers of a conversation into resolved library references. */
public interface MentionResolver {

  /**
   * Resolves the library items the latest message depends on.
   *
   * <p>Candidates are the markers of the current message plus the markers of prior assistant
   * turns. Items that do not exist, are inactive or belong to another user are skipped.
   *
   * @param userId the caller
   * @param message the latest user message
   * @param priorTurns prior turns of the session, oldest first
   * @param summary rolling digest of the conversation
   * @return the resolved references, empty when the conversation holds no markers
   */
  List<Reference> resolve(Long userId, String message, List<ChatTurn> priorTurns, String summary);
}
