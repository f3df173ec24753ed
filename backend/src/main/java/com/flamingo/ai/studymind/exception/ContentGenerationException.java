package com.flamingo.ai.studymind.exception;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** Exception thrown when rendering or generating the content of an item fails. */
public class ContentGenerationException extends RuntimeException {

  private final LibraryItemType itemType;
  private final String itemName;

  public ContentGenerationException(
      LibraryItemType itemType, String itemName, String message, Throwable cause) {
    super(message, cause);
    this.itemType = itemType;
    this.itemName = itemName;
  }

  public ContentGenerationException(LibraryItemType itemType, String itemName, String message) {
    super(message);
    this.itemType = itemType;
    this.itemName = itemName;
  }

  public LibraryItemType getItemType() {
    return itemType;
  }

  public String getItemName() {
    return itemName;
  }

  public String getUserMessage() {
    return "Content generation failed while creating the "
        + itemType.name().toLowerCase()
        + " '"
        + itemName
        + "'. Nothing was saved, please try again.";
  }
}
