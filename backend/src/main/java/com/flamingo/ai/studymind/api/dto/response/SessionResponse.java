package com.flamingo.ai.studymind.api.dto.response;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID uid;
  private String title;
  private String description;
  private String summary;
  private String lastMessage;
  private LocalDateTime lastMessageAt;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a SessionResponse from a ChatSession entity. */
  public static SessionResponse fromEntity(ChatSession session) {
    return SessionResponse.builder()
        .uid(session.getUid())
        .title(session.getTitle())
        .description(session.getDescription())
        .summary(session.getSummary())
        .lastMessage(session.getLastMessage())
        .lastMessageAt(session.getLastMessageAt())
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .build();
  }
}
