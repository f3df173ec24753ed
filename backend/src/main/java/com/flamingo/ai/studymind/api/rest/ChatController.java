package com.flamingo.ai.studymind.api.rest;

import com.flamingo.ai.studymind.api.dto.request.ChatRequest;
import com.flamingo.ai.studymind.api.dto.response.ChatQueryResponse;
import com.flamingo.ai.studymind.api.dto.response.ChatTurnResponse;
import com.flamingo.ai.studymind.api.dto.response.SessionDetailResponse;
import com.flamingo.ai.studymind.api.dto.response.SessionResponse;
import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.service.orchestrator.ChatExchange;
import com.flamingo.ai.studymind.service.orchestrator.ChatOrchestrator;
import com.flamingo.ai.studymind.service.session.ChatSessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chat sessions. The caller is identified by the {@code X-User-Id} header. */
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatController {

  static final String USER_HEADER = "X-User-Id";

  private final ChatSessionService chatSessionService;
  private final ChatOrchestrator chatOrchestrator;

  /** Lists the caller's sessions, optionally filtered by title. */
  @GetMapping
  public ResponseEntity<List<SessionResponse>> listChats(
      @RequestHeader(USER_HEADER) Long userId,
      @RequestParam(required = false) String search) {
    List<SessionResponse> responses =
        chatSessionService.listSessions(userId, search).stream()
            .map(SessionResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a session with its turns. */
  @GetMapping("/{uid}")
  public ResponseEntity<SessionDetailResponse> getChat(
      @RequestHeader(USER_HEADER) Long userId, @PathVariable UUID uid) {
    ChatSession session = chatSessionService.getSession(userId, uid);
    List<ChatTurnResponse> turns =
        chatSessionService.getTurns(session).stream().map(ChatTurnResponse::fromEntity).toList();
    return ResponseEntity.ok(
        new SessionDetailResponse(SessionResponse.fromEntity(session), turns));
  }

  /** Sends a message to a session, creating the session on first use. */
  @PatchMapping("/{uid}")
  public ResponseEntity<ChatQueryResponse> sendMessage(
      @RequestHeader(USER_HEADER) Long userId,
      @PathVariable UUID uid,
      @Valid @RequestBody ChatRequest request) {
    ChatExchange exchange = chatOrchestrator.handle(userId, uid, request.getMessage());
    return ResponseEntity.ok(ChatQueryResponse.fromExchange(exchange));
  }

  /** Deletes a session. */
  @DeleteMapping("/{uid}")
  public ResponseEntity<Void> deleteChat(
      @RequestHeader(USER_HEADER) Long userId, @PathVariable UUID uid) {
    chatSessionService.softDelete(userId, uid);
    return ResponseEntity.noContent().build();
  }
}
