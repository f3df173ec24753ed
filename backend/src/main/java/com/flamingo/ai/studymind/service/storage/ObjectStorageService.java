package com.flamingo.ai.studymind.service.storage;

/** Service interface for storing generated files. */
public interface ObjectStorageService {

  /**
   * Stores a file.
   *
   * @param fileName target file name, made unique by the implementation
   * @param data file contents
   * @param contentType MIME type hint
   * @return where the file was stored and how to reach it
   */
  StoredArtifact upload(String fileName, byte[] data, String contentType);

  /**
   * Reads a stored file.
   *
   * @param path the path returned by {@link #upload}
   * @return file contents
   */
  byte[] download(String path);

  /**
   * Removes a stored file. Missing files are ignored.
   *
   * @param path the path returned by {@link #upload}
   */
  void delete(String path);
}
