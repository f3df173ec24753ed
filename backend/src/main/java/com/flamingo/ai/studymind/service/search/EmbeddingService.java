package com.flamingo.ai.studymind.service.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for embedding search queries with the OpenAI embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; queries are kept well below that
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a query.
   *
   * @param text query text
   * @return the embedding vector, or an empty list when the provider is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  public List<Float> embedQuery(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Query too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success").increment();
      float[] vector = response.content().vector();
      List<Float> result = new ArrayList<>(vector.length);
      for (float f : vector) {
        result.add(f);
      }
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String text, Throwable t) {
    log.warn("Query embedding failed, falling back to keyword search only: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
