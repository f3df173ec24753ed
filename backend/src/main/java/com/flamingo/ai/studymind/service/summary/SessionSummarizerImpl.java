package com.flamingo.ai.studymind.service.summary;

import com.flamingo.ai.studymind.agent.SessionSummaryAgent;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.marker.InlineMarker;
import com.flamingo.ai.studymind.service.marker.MarkerParser;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Summarization backed by {@link SessionSummaryAgent}.
 *
 * <p>The model is asked to copy marker literals, and the output is then corrected: invented
 * markers are removed and missing ones are appended on a final line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionSummarizerImpl implements SessionSummarizer {

  private final SessionSummaryAgent sessionSummaryAgent;
  private final StudyMindConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.summarize", description = "Time to summarize session history")
  @CircuitBreaker(name = "openai", fallbackMethod = "summarizeFallback")
  public String summarize(List<ChatTurn> priorTurns) {
    if (priorTurns == null || priorTurns.isEmpty()) {
      log.debug("No prior turns, skipping summarization");
      return "";
    }

    int windowSize = config.getSummary().getWindowSize();
    List<ChatTurn> window =
        priorTurns.subList(Math.max(0, priorTurns.size() - windowSize), priorTurns.size());

    Set<String> literals = new LinkedHashSet<>();
    for (ChatTurn turn : window) {
      MarkerParser.parse(turn.getMessage()).forEach(marker -> literals.add(marker.literal()));
    }

    String conversation =
        window.stream().map(this::formatTurn).collect(Collectors.joining("\n"));
    String tags = literals.isEmpty() ? "(none)" : String.join("\n", literals);

    String raw;
    try {
      raw = sessionSummaryAgent.summarize(conversation, tags);
    } catch (RuntimeException e) {
      log.error("Session summarization call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Session summarization failed", e);
    }

    String summary = enforceMarkers(raw == null ? "" : raw, literals);
    log.debug(
        "Summarized {} turns ({} markers) into {} chars",
        window.size(),
        literals.size(),
        summary.length());
    return summary;
  }

  /** Drops markers the input never contained and appends the ones the output lost. */
  String enforceMarkers(String summary, Set<String> inputLiterals) {
    String corrected = summary;
    for (InlineMarker marker : MarkerParser.parse(summary)) {
      if (!inputLiterals.contains(marker.literal())) {
        log.warn("Summary contained a marker absent from history, removing: {}", marker.literal());
        meterRegistry.counter("pipeline.summary.markers.removed").increment();
        corrected = corrected.replace(marker.literal(), "");
      }
    }

    String finalText = corrected;
    List<String> missing =
        inputLiterals.stream().filter(literal -> !finalText.contains(literal)).toList();
    if (missing.isEmpty()) {
      return corrected.trim();
    }
    meterRegistry.counter("pipeline.summary.markers.restored").increment(missing.size());
    return (corrected.trim() + "\n\nReferenced items: " + String.join(" ", missing)).trim();
  }

  private String formatTurn(ChatTurn turn) {
    String message = turn.getMessage() == null ? "" : turn.getMessage();
    int maxChars = config.getSummary().getMaxTurnChars();
    if (message.length() > maxChars) {
      message = truncateKeepingMarkers(message, maxChars);
    }
    return turn.getRole().name() + ": " + message;
  }

  /** Truncates long prose but re-attaches markers that fell past the cut. */
  private static String truncateKeepingMarkers(String message, int maxChars) {
    String head = message.substring(0, maxChars);
    String tail =
        MarkerParser.parse(message).stream()
            .map(InlineMarker::literal)
            .filter(literal -> !head.contains(literal))
            .collect(Collectors.joining(" "));
    return tail.isEmpty() ? head + "..." : head + "... " + tail;
  }

  @SuppressWarnings("unused")
  private String summarizeFallback(List<ChatTurn> priorTurns, CallNotPermittedException e) {
    log.warn("Session summarization circuit open: {}", e.getMessage());
    throw new LlmServiceException("Session summarization is unavailable", e);
  }
}
