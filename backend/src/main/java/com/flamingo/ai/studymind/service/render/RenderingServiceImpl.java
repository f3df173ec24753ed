package com.flamingo.ai.studymind.service.render;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.exception.ContentGenerationException;
import com.flamingo.ai.studymind.service.storage.ObjectStorageService;
import com.flamingo.ai.studymind.service.storage.StoredArtifact;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link RenderingService}: render locally or remotely, then store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RenderingServiceImpl implements RenderingService {

  private final MarkdownPdfRenderer markdownPdfRenderer;
  private final MediaGenerationClient mediaGenerationClient;
  private final ObjectStorageService objectStorageService;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "render.document", description = "Time to render a document to PDF")
  public StoredArtifact renderDocument(String name, String markdown) {
    byte[] pdf;
    try {
      pdf = markdownPdfRenderer.render(name, markdown);
    } catch (IOException | RuntimeException e) {
      throw failure(LibraryItemType.DOCUMENT, name, e);
    }
    return store(LibraryItemType.DOCUMENT, name, pdf, "pdf", "application/pdf");
  }

  @Override
  public StoredArtifact renderAudio(String name, String script) {
    byte[] audio;
    try {
      audio = mediaGenerationClient.synthesizeSpeech(script);
    } catch (RuntimeException e) {
      throw failure(LibraryItemType.AUDIO, name, e);
    }
    return store(LibraryItemType.AUDIO, name, audio, "mp3", "audio/mpeg");
  }

  @Override
  public StoredArtifact renderImage(String name, String description, int width, int height) {
    byte[] image;
    try {
      image = mediaGenerationClient.generateImage(description, width, height);
    } catch (RuntimeException e) {
      throw failure(LibraryItemType.IMAGE, name, e);
    }
    return store(LibraryItemType.IMAGE, name, image, "png", "image/png");
  }

  private StoredArtifact store(
      LibraryItemType type, String name, byte[] data, String extension, String contentType) {
    try {
      StoredArtifact artifact =
          objectStorageService.upload(name + "." + extension, data, contentType);
      meterRegistry.counter("render.success", "type", type.name()).increment();
      log.info("Rendered {} '{}' to {} ({} bytes)", type, name, artifact.path(), artifact.size());
      return artifact;
    } catch (RuntimeException e) {
      throw failure(type, name, e);
    }
  }

  private ContentGenerationException failure(LibraryItemType type, String name, Exception e) {
    meterRegistry.counter("render.failure", "type", type.name()).increment();
    log.error("Rendering {} '{}' failed: {}", type, name, e.getMessage());
    return new ContentGenerationException(
        type, name, "Failed to render " + type + " '" + name + "': " + e.getMessage(), e);
  }
}
