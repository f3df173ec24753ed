package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** A rendered speech clip. Duration is in seconds. */
public record AudioMetadata(
    String description,
    String fileType,
    String filePath,
    String fileUrl,
    Long fileSize,
    Integer duration)
    implements FileMetadata {

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.AUDIO;
  }

  @Override
  public AudioMetadata withFile(String filePath, String fileUrl, long fileSize) {
    return new AudioMetadata(description, "mp3", filePath, fileUrl, fileSize, duration);
  }
}
