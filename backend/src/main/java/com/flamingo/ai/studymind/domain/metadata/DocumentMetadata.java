package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** A rendered PDF document. */
public record DocumentMetadata(
    String description, String fileType, String filePath, String fileUrl, Long fileSize)
    implements FileMetadata {

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.DOCUMENT;
  }

  @Override
  public DocumentMetadata withFile(String filePath, String fileUrl, long fileSize) {
    return new DocumentMetadata(description, "pdf", filePath, fileUrl, fileSize);
  }
}
