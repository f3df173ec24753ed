package com.flamingo.ai.studymind.domain.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/**
 * Type-specific payload of a library item.
 *
 * <p>Stored as JSON with a {@code type} discriminator matching {@link LibraryItemType}, so every
 * item type has exactly one metadata shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FolderMetadata.class, name = "FOLDER"),
  @JsonSubTypes.Type(value = NoteMetadata.class, name = "NOTE"),
  @JsonSubTypes.Type(value = DocumentMetadata.class, name = "DOCUMENT"),
  @JsonSubTypes.Type(value = FlashcardMetadata.class, name = "FLASHCARD"),
  @JsonSubTypes.Type(value = AudioMetadata.class, name = "AUDIO"),
  @JsonSubTypes.Type(value = VideoMetadata.class, name = "VIDEO"),
  @JsonSubTypes.Type(value = ImageMetadata.class, name = "IMAGE")
})
public interface LibraryItemMetadata {

  /** The item type this payload belongs to. */
  @JsonIgnore
  LibraryItemType itemType();
}
