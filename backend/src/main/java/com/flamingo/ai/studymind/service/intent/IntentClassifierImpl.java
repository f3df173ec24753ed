package com.flamingo.ai.studymind.service.intent;

import com.flamingo.ai.studymind.agent.IntentClassificationAgent;
import com.flamingo.ai.studymind.agent.dto.IntentClassificationResult;
import com.flamingo.ai.studymind.domain.enums.Intent;
import com.flamingo.ai.studymind.exception.IntentClassificationException;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Intent classification backed by {@link IntentClassificationAgent}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentClassifierImpl implements IntentClassifier {

  static final String DEFAULT_TITLE = "New Chat";

  private final IntentClassificationAgent intentClassificationAgent;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.classify", description = "Time to classify a message")
  @CircuitBreaker(name = "openai", fallbackMethod = "classifyFallback")
  public ClassifiedIntent classify(String message, String summary) {
    IntentClassificationResult result;
    try {
      result = intentClassificationAgent.classify(message, summary == null ? "" : summary);
    } catch (RuntimeException e) {
      log.error("Intent classification call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Intent classification failed", e);
    }

    Intent intent = parseIntent(result);
    String title = isBlank(result.title()) ? DEFAULT_TITLE : result.title().trim();
    String description = isBlank(result.description()) ? "" : result.description().trim();

    meterRegistry.counter("pipeline.intent", "intent", intent.name()).increment();
    log.info("Classified message as {} (title='{}')", intent, title);
    return new ClassifiedIntent(intent, title, description);
  }

  private static Intent parseIntent(IntentClassificationResult result) {
    if (result == null || isBlank(result.intent())) {
      throw new IntentClassificationException("Classifier returned no intent");
    }
    try {
      return Intent.valueOf(result.intent().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IntentClassificationException("Unknown intent label: " + result.intent());
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @SuppressWarnings("unused")
  private ClassifiedIntent classifyFallback(
      String message, String summary, CallNotPermittedException e) {
    log.warn("Intent classification circuit open: {}", e.getMessage());
    throw new LlmServiceException("Intent classification is unavailable", e);
  }
}
