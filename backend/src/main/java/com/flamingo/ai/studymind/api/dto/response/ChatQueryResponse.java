package com.flamingo.ai.studymind.api.dto.response;

import com.flamingo.ai.studymind.service.orchestrator.ChatExchange;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a chat request. {@code message} is the reply with inline markers removed;
 * {@code createdItems} carries what the markers pointed to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatQueryResponse {

  private SessionResponse session;
  private String message;
  private List<LibraryItemResponse> createdItems;

  public static ChatQueryResponse fromExchange(ChatExchange exchange) {
    return ChatQueryResponse.builder()
        .session(SessionResponse.fromEntity(exchange.session()))
        .message(exchange.reply().displayMessage())
        .createdItems(
            exchange.createdItems().stream().map(LibraryItemResponse::fromEntity).toList())
        .build();
  }
}
