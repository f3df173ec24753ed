package com.flamingo.ai.studymind.domain.enums;

/** Kinds of nodes in a user's content library. */
public enum LibraryItemType {
  FOLDER,
  NOTE,
  DOCUMENT,
  FLASHCARD,
  AUDIO,
  VIDEO,
  IMAGE;

  /**
   * Whether items of this type are produced by an external rendering call and therefore need a
   * generation prompt.
   */
  public boolean isRendered() {
    return this == DOCUMENT || this == AUDIO || this == VIDEO || this == IMAGE;
  }

  /** Whether items of this type can be used for retrieval as soon as they are stored. */
  public boolean isEmbeddedOnCreate() {
    return !isRendered();
  }

  /**
   * Parses a type label, ignoring case and surrounding whitespace.
   *
   * @return the type, or {@code null} when the label is not a known type
   */
  public static LibraryItemType fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return null;
    }
    try {
      return valueOf(label.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
