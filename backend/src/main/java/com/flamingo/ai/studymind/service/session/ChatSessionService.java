package com.flamingo.ai.studymind.service.session;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.service.intent.ClassifiedIntent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Service interface for chat session persistence. */
public interface ChatSessionService {

  /**
   * Lists a user's active sessions, most recently updated first.
   *
   * @param userId the owner
   * @param search optional case-insensitive title filter
   * @return matching sessions
   */
  List<ChatSession> listSessions(Long userId, String search);

  /**
   * Gets an active session owned by the user.
   *
   * @throws com.flamingo.ai.studymind.exception.SessionNotFoundException when the session is
   *     missing, inactive or owned by someone else
   */
  ChatSession getSession(Long userId, UUID sessionUid);

  /**
   * Looks up a session that a chat request may continue.
   *
   * @return empty when no session with this uid exists yet
   * @throws com.flamingo.ai.studymind.exception.SessionNotFoundException when the uid is taken by
   *     another user or by a deleted session
   */
  Optional<ChatSession> findActiveOwned(Long userId, UUID sessionUid);

  /** Gets the turns of a session in chronological order. */
  List<ChatTurn> getTurns(ChatSession session);

  /**
   * Creates the session on first use, or refreshes summary and last message of an existing one.
   *
   * @param classification supplies title and description for new sessions
   */
  ChatSession upsertSession(
      Long userId,
      UUID sessionUid,
      ClassifiedIntent classification,
      String summary,
      String userMessage);

  /** Appends a turn; the uids of inline markers in the message are recorded with it. */
  ChatTurn appendTurn(ChatSession session, MessageRole role, String message);

  /** Marks a session inactive. */
  void softDelete(Long userId, UUID sessionUid);
}
