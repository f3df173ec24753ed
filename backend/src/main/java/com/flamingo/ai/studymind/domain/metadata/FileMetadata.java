package com.flamingo.ai.studymind.domain.metadata;

/** Metadata of an item backed by a rendered file in object storage. */
public interface FileMetadata extends LibraryItemMetadata {

  String description();

  String fileType();

  String filePath();

  String fileUrl();

  Long fileSize();

  /** Returns a copy with the stored file attached. */
  FileMetadata withFile(String filePath, String fileUrl, long fileSize);
}
