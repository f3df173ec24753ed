package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;

/** A generated image. Resolution is formatted as {@code WIDTHxHEIGHT}. */
public record ImageMetadata(
    String description,
    String fileType,
    String filePath,
    String fileUrl,
    Long fileSize,
    String resolution)
    implements FileMetadata {

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.IMAGE;
  }

  @Override
  public ImageMetadata withFile(String filePath, String fileUrl, long fileSize) {
    return new ImageMetadata(description, "png", filePath, fileUrl, fileSize, resolution);
  }

  /** Returns a copy with the given resolution. */
  public ImageMetadata withResolution(String newResolution) {
    return new ImageMetadata(description, fileType, filePath, fileUrl, fileSize, newResolution);
  }
}
