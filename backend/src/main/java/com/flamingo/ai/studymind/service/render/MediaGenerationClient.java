package com.flamingo.ai.studymind.service.render;

import com.flamingo.ai.studymind.config.StudyMindConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the text-to-speech and image-generation endpoints. Encapsulates all WebClient
 * communication with the rendering providers.
 *
 * <p>Both endpoints are plain GET requests whose URL templates come from {@link
 * StudyMindConfig.Rendering}; the prompt is URL-encoded into the path.
 */
@Component
@Slf4j
public class MediaGenerationClient {

  private final WebClient webClient;
  private final StudyMindConfig.Rendering rendering;

  public MediaGenerationClient(StudyMindConfig config) {
    this.rendering = config.getRendering();
    this.webClient =
        WebClient.builder()
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(rendering.getMaxResponseBytes()))
            .build();
    log.info(
        "Media generation client initialized: speech={}, image={}",
        rendering.getSpeechUrlTemplate(),
        rendering.getImageUrlTemplate());
  }

  /**
   * Synthesizes speech for a script.
   *
   * @param script text to read aloud
   * @return MP3 bytes
   */
  @Timed(value = "render.speech", description = "Time to synthesize speech")
  @CircuitBreaker(name = "rendering")
  public byte[] synthesizeSpeech(String script) {
    return fetch(
        rendering.getSpeechUrlTemplate(), Map.of("prompt", script, "voice", rendering.getVoice()));
  }

  /**
   * Generates an image for a description.
   *
   * @param description what the image should show
   * @param width pixel width
   * @param height pixel height
   * @return PNG bytes
   */
  @Timed(value = "render.image", description = "Time to generate image")
  @CircuitBreaker(name = "rendering")
  public byte[] generateImage(String description, int width, int height) {
    return fetch(
        rendering.getImageUrlTemplate(),
        Map.of("prompt", description, "width", width, "height", height));
  }

  private byte[] fetch(String uriTemplate, Map<String, ?> variables) {
    byte[] body =
        webClient
            .get()
            .uri(uriTemplate, variables)
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(Duration.ofMillis(rendering.getReadTimeoutMs()))
            .block();
    if (body == null || body.length == 0) {
      throw new IllegalStateException("Rendering endpoint returned an empty body");
    }
    return body;
  }
}
