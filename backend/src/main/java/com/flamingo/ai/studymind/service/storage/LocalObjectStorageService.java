package com.flamingo.ai.studymind.service.storage;

import com.flamingo.ai.studymind.config.StudyMindConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Object storage on the local filesystem.
 *
 * <p>Files land under {@code <basePath>/<yyyy-MM-dd>/} and are published under the configured
 * public base URL with the same relative path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalObjectStorageService implements ObjectStorageService {

  private final StudyMindConfig config;

  @Override
  public StoredArtifact upload(String fileName, byte[] data, String contentType) {
    if (data == null || data.length == 0) {
      throw new IllegalArgumentException("Refusing to store empty file " + fileName);
    }
    long maxBytes = config.getStorage().getMaxFileSizeBytes();
    if (data.length > maxBytes) {
      throw new IllegalArgumentException(
          "File " + fileName + " is " + data.length + " bytes, limit is " + maxBytes);
    }

    String relativePath = LocalDate.now() + "/" + uniqueName(fileName);
    Path target = basePath().resolve(relativePath);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, data);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store " + relativePath, e);
    }

    log.debug("Stored {} ({} bytes, {})", relativePath, data.length, contentType);
    return new StoredArtifact(relativePath, publicUrl(relativePath), data.length, contentType);
  }

  @Override
  public byte[] download(String path) {
    try {
      return Files.readAllBytes(resolveInside(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
  }

  @Override
  public void delete(String path) {
    try {
      if (Files.deleteIfExists(resolveInside(path))) {
        log.debug("Deleted stored file {}", path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete " + path, e);
    }
  }

  private Path basePath() {
    return Path.of(config.getStorage().getBasePath()).toAbsolutePath().normalize();
  }

  private Path resolveInside(String path) {
    Path base = basePath();
    Path resolved = base.resolve(path).normalize();
    if (!resolved.startsWith(base)) {
      throw new IllegalArgumentException("Path escapes storage root: " + path);
    }
    return resolved;
  }

  private String publicUrl(String relativePath) {
    String baseUrl = config.getStorage().getPublicBaseUrl();
    return baseUrl.endsWith("/") ? baseUrl + relativePath : baseUrl + "/" + relativePath;
  }

  private static String uniqueName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    String extension = dot > 0 ? fileName.substring(dot) : "";
    String safeStem = stem.replaceAll("[^a-zA-Z0-9]", "_").toLowerCase(Locale.ROOT);
    return safeStem + "_" + UUID.randomUUID() + extension.toLowerCase(Locale.ROOT);
  }
}
