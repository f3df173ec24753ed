package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** A note: short description plus a markdown body. */
public record NoteMetadata(String description, String notes) implements LibraryItemMetadata {

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.NOTE;
  }
}
