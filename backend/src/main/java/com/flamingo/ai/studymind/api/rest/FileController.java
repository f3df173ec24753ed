package com.flamingo.ai.studymind.api.rest;

import com.flamingo.ai.studymind.service.storage.ObjectStorageService;
import java.io.UncheckedIOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves rendered files under the public base URL of the local object storage.
 *
 * <p>Paths look like {@code /files/2026-01-31/cell_biology_1769800000000.pdf}.
 */
@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
@Slf4j
public class FileController {

  private final ObjectStorageService objectStorageService;

  @GetMapping("/{day}/{fileName:.+}")
  public ResponseEntity<byte[]> getFile(@PathVariable String day, @PathVariable String fileName) {
    String path = day + "/" + fileName;
    byte[] bytes;
    try {
      bytes = objectStorageService.download(path);
    } catch (UncheckedIOException | IllegalArgumentException e) {
      log.warn("Stored file not available: {} ({})", path, e.getMessage());
      return ResponseEntity.notFound().build();
    }
    MediaType mediaType =
        MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM);
    return ResponseEntity.ok().contentType(mediaType).body(bytes);
  }
}
