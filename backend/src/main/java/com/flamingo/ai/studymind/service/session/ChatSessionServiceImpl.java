package com.flamingo.ai.studymind.service.session;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.domain.repository.ChatSessionRepository;
import com.flamingo.ai.studymind.domain.repository.ChatTurnRepository;
import com.flamingo.ai.studymind.exception.SessionNotFoundException;
import com.flamingo.ai.studymind.service.intent.ClassifiedIntent;
import com.flamingo.ai.studymind.service.marker.InlineMarker;
import com.flamingo.ai.studymind.service.marker.MarkerParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the ChatSessionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatSessionServiceImpl implements ChatSessionService {

  static final int PREVIEW_LENGTH = 200;

  private final ChatSessionRepository chatSessionRepository;
  private final ChatTurnRepository chatTurnRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.list", description = "Time to list sessions")
  public List<ChatSession> listSessions(Long userId, String search) {
    if (search == null || search.isBlank()) {
      return chatSessionRepository.findByUserIdAndIsActiveTrueOrderByUpdatedAtDesc(userId);
    }
    return chatSessionRepository.searchActiveByTitle(userId, search.trim());
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.get", description = "Time to get a session")
  public ChatSession getSession(Long userId, UUID sessionUid) {
    return findActiveOwned(userId, sessionUid)
        .orElseThrow(() -> new SessionNotFoundException(sessionUid));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ChatSession> findActiveOwned(Long userId, UUID sessionUid) {
    Optional<ChatSession> found = chatSessionRepository.findByUid(sessionUid);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    ChatSession session = found.get();
    if (!session.getUserId().equals(userId) || !Boolean.TRUE.equals(session.getIsActive())) {
      log.warn("Session {} is not available to user {}", sessionUid, userId);
      throw new SessionNotFoundException(sessionUid);
    }
    return found;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatTurn> getTurns(ChatSession session) {
    if (session.getId() == null) {
      return List.of();
    }
    return chatTurnRepository.findBySessionIdOrderByCreatedAtAscIdAsc(session.getId());
  }

  @Override
  @Transactional
  @Timed(value = "session.upsert", description = "Time to create or update a session")
  public ChatSession upsertSession(
      Long userId,
      UUID sessionUid,
      ClassifiedIntent classification,
      String summary,
      String userMessage) {
    Optional<ChatSession> existing = findActiveOwned(userId, sessionUid);
    ChatSession session;
    if (existing.isPresent()) {
      session = existing.get();
    } else {
      session =
          ChatSession.builder()
              .uid(sessionUid)
              .userId(userId)
              .title(classification.title())
              .description(classification.description())
              .build();
      meterRegistry.counter("session.created").increment();
      log.info("Creating session {} '{}' for user {}", sessionUid, session.getTitle(), userId);
    }
    session.setSummary(summary);
    session.recordLastMessage(preview(userMessage));
    return chatSessionRepository.save(session);
  }

  @Override
  @Transactional
  public ChatTurn appendTurn(ChatSession session, MessageRole role, String message) {
    List<String> referenceUids =
        MarkerParser.parse(message).stream()
            .map(InlineMarker::uid)
            .distinct()
            .collect(Collectors.toList());
    ChatTurn turn =
        ChatTurn.builder()
            .session(session)
            .role(role)
            .message(message)
            .referenceUids(referenceUids)
            .build();
    return chatTurnRepository.save(turn);
  }

  @Override
  @Transactional
  @Timed(value = "session.delete", description = "Time to delete a session")
  public void softDelete(Long userId, UUID sessionUid) {
    ChatSession session = getSession(userId, sessionUid);
    session.setIsActive(false);
    chatSessionRepository.save(session);
    log.info("Soft-deleted session {} for user {}", sessionUid, userId);
    meterRegistry.counter("session.deleted").increment();
  }

  private static String preview(String message) {
    String text = MarkerParser.strip(message);
    return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
  }
}
