package com.flamingo.ai.studymind.domain.entity;

import com.flamingo.ai.studymind.domain.converter.LibraryItemMetadataConverter;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A node of a user's content tree. A null parent means the item sits at the root. */
@Entity
@Table(
    name = "library_items",
    indexes = {
      @Index(name = "idx_library_items_user", columnList = "userId"),
      @Index(name = "idx_library_items_parent", columnList = "parentId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LibraryItem {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  @Builder.Default
  private UUID uid = UUID.randomUUID();

  @Column(nullable = false)
  private Long userId;

  private Long parentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private LibraryItemType type;

  @Column(nullable = false)
  private String name;

  @Convert(converter = LibraryItemMetadataConverter.class)
  @Column(columnDefinition = "TEXT")
  private LibraryItemMetadata metadata;

  @Builder.Default private Boolean isActive = true;

  /** False until an out-of-band embedding step has indexed the item for search. */
  @Builder.Default private Boolean isEmbedded = false;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
