package com.flamingo.ai.studymind.api.dto.response;

import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a library item created by a chat request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LibraryItemResponse {

  private UUID uid;
  private Long id;
  private Long parentId;
  private LibraryItemType type;
  private String name;
  private LibraryItemMetadata metadata;
  private boolean embedded;
  private LocalDateTime createdAt;

  public static LibraryItemResponse fromEntity(LibraryItem item) {
    return LibraryItemResponse.builder()
        .uid(item.getUid())
        .id(item.getId())
        .parentId(item.getParentId())
        .type(item.getType())
        .name(item.getName())
        .metadata(item.getMetadata())
        .embedded(Boolean.TRUE.equals(item.getIsEmbedded()))
        .createdAt(item.getCreatedAt())
        .build();
  }
}
