package com.flamingo.ai.studymind.exception;

/** Exception thrown when a library item is missing, inactive or owned by someone else. */
public class LibraryItemNotFoundException extends RuntimeException {

  private final String itemRef;

  public LibraryItemNotFoundException(String itemRef) {
    super("Library item not found: " + itemRef);
    this.itemRef = itemRef;
  }

  public String getItemRef() {
    return itemRef;
  }
}
