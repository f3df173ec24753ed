package com.flamingo.ai.studymind.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymind.api.dto.request.ChatRequest;
import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.domain.metadata.FolderMetadata;
import com.flamingo.ai.studymind.exception.ApiError;
import com.flamingo.ai.studymind.exception.GlobalExceptionHandler;
import com.flamingo.ai.studymind.exception.SessionNotFoundException;
import com.flamingo.ai.studymind.service.orchestrator.ChatExchange;
import com.flamingo.ai.studymind.service.orchestrator.ChatOrchestrator;
import com.flamingo.ai.studymind.service.reply.SynthesizedReply;
import com.flamingo.ai.studymind.service.session.ChatSessionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatController Tests")
class ChatControllerTest {

  private static final Long USER_ID = 7L;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ChatSessionService chatSessionService;
  @Mock private ChatOrchestrator chatOrchestrator;

  @BeforeEach
  void setUp() {
    ChatController chatController = new ChatController(chatSessionService, chatOrchestrator);
    mockMvc =
        MockMvcBuilders.standaloneSetup(chatController)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return display message and created items")
  void shouldReturnDisplayMessageAndCreatedItems_whenMessageSent() throws Exception {
    // Given
    UUID uid = UUID.randomUUID();
    ChatSession session = session(uid, "Biology");
    LibraryItem folder =
        LibraryItem.builder()
            .id(11L)
            .userId(USER_ID)
            .type(LibraryItemType.FOLDER)
            .name("Biology")
            .metadata(new FolderMetadata("#A8C686", "book"))
            .isEmbedded(true)
            .build();
    ChatExchange exchange =
        new ChatExchange(
            session,
            new SynthesizedReply(
                "Done @created {uid: 'x', name: 'Biology', type: 'FOLDER'}", "Done"),
            List.of(folder));
    when(chatOrchestrator.handle(USER_ID, uid, "Create a Biology folder")).thenReturn(exchange);

    // When / Then
    mockMvc
        .perform(
            patch("/api/chats/{uid}", uid)
                .header(ChatController.USER_HEADER, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        ChatRequest.builder().message("Create a Biology folder").build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Done"))
        .andExpect(jsonPath("$.session.uid").value(uid.toString()))
        .andExpect(jsonPath("$.createdItems[0].name").value("Biology"))
        .andExpect(jsonPath("$.createdItems[0].type").value("FOLDER"))
        .andExpect(jsonPath("$.createdItems[0].metadata.icon").value("book"));
  }

  @Test
  @DisplayName("Should reject blank messages")
  void shouldReturnBadRequest_whenMessageBlank() throws Exception {
    mockMvc
        .perform(
            patch("/api/chats/{uid}", UUID.randomUUID())
                .header(ChatController.USER_HEADER, USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verifyNoInteractions(chatOrchestrator);
  }

  @Test
  @DisplayName("Should require caller identity header")
  void shouldReturnBadRequest_whenUserHeaderMissing() throws Exception {
    mockMvc
        .perform(get("/api/chats"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should list sessions")
  void shouldListSessions() throws Exception {
    // Given
    UUID uid = UUID.randomUUID();
    when(chatSessionService.listSessions(USER_ID, "bio"))
        .thenReturn(List.of(session(uid, "Biology")));

    // When / Then
    mockMvc
        .perform(get("/api/chats").param("search", "bio").header(ChatController.USER_HEADER, 7))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].uid").value(uid.toString()))
        .andExpect(jsonPath("$[0].title").value("Biology"));
  }

  @Test
  @DisplayName("Should return session with turns")
  void shouldReturnSessionWithTurns() throws Exception {
    // Given
    UUID uid = UUID.randomUUID();
    ChatSession session = session(uid, "Biology");
    when(chatSessionService.getSession(USER_ID, uid)).thenReturn(session);
    when(chatSessionService.getTurns(session))
        .thenReturn(
            List.of(
                ChatTurn.builder().role(MessageRole.USER).message("Hi").build(),
                ChatTurn.builder().role(MessageRole.ASSISTANT).message("Hello").build()));

    // When / Then
    mockMvc
        .perform(get("/api/chats/{uid}", uid).header(ChatController.USER_HEADER, USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.session.title").value("Biology"))
        .andExpect(jsonPath("$.turns.length()").value(2))
        .andExpect(jsonPath("$.turns[1].role").value("ASSISTANT"));
  }

  @Test
  @DisplayName("Should return 404 for sessions of other users")
  void shouldReturnNotFound_whenSessionNotOwned() throws Exception {
    // Given
    UUID uid = UUID.randomUUID();
    when(chatSessionService.getSession(USER_ID, uid)).thenThrow(new SessionNotFoundException(uid));

    // When / Then
    mockMvc
        .perform(get("/api/chats/{uid}", uid).header(ChatController.USER_HEADER, USER_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.SESSION_NOT_FOUND));
  }

  @Test
  @DisplayName("Should soft delete session")
  void shouldSoftDeleteSession() throws Exception {
    // Given
    UUID uid = UUID.randomUUID();

    // When / Then
    mockMvc
        .perform(delete("/api/chats/{uid}", uid).header(ChatController.USER_HEADER, USER_ID))
        .andExpect(status().isNoContent());

    verify(chatSessionService).softDelete(USER_ID, uid);
  }

  private static ChatSession session(UUID uid, String title) {
    return ChatSession.builder().id(1L).uid(uid).userId(USER_ID).title(title).build();
  }
}
