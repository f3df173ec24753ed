package com.flamingo.ai.studymind.api.dto.response;

import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for one chat turn. The message keeps its inline markers so clients can render
 * them as links.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnResponse {

  private UUID uid;
  private MessageRole role;
  private String message;
  private List<String> referenceUids;
  private LocalDateTime createdAt;

  public static ChatTurnResponse fromEntity(ChatTurn turn) {
    return ChatTurnResponse.builder()
        .uid(turn.getUid())
        .role(turn.getRole())
        .message(turn.getMessage())
        .referenceUids(turn.getReferenceUids())
        .createdAt(turn.getCreatedAt())
        .build();
  }
}
