package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import java.util.List;

/** A flashcard deck. */
public record FlashcardMetadata(String description, List<Flashcard> cards, Integer cardCount)
    implements LibraryItemMetadata {

  public static final int MAX_CARDS = 10;

  public FlashcardMetadata {
    cards = cards == null ? List.of() : List.copyOf(cards);
  }

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.FLASHCARD;
  }

  /** Returns a copy holding the given cards, with {@code cardCount} kept in sync. */
  public FlashcardMetadata withCards(List<Flashcard> newCards) {
    return new FlashcardMetadata(description, newCards, newCards.size());
  }
}
