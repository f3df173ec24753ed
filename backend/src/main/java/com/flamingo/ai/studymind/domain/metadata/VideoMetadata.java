package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** A video clip. Videos are planned but cannot be rendered yet. */
public record VideoMetadata(
    String description,
    String fileType,
    String filePath,
    String fileUrl,
    Long fileSize,
    Integer duration)
    implements FileMetadata {

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.VIDEO;
  }

  @Override
  public VideoMetadata withFile(String filePath, String fileUrl, long fileSize) {
    return new VideoMetadata(description, "mp4", filePath, fileUrl, fileSize, duration);
  }
}
