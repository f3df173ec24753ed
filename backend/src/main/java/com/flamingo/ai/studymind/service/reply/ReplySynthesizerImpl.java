package com.flamingo.ai.studymind.service.reply;

import com.flamingo.ai.studymind.agent.ContentAnalysisAgent;
import com.flamingo.ai.studymind.agent.CreationConfirmationAgent;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.Intent;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.marker.MarkerKind;
import com.flamingo.ai.studymind.service.marker.MarkerParser;
import com.flamingo.ai.studymind.service.orchestrator.PipelineState;
import com.flamingo.ai.studymind.service.reference.Reference;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Reply synthesis over the prose chat model and the analysis/confirmation agents. */
@Service
@Slf4j
public class ReplySynthesizerImpl implements ReplySynthesizer {

  static final String SYSTEM_PROMPT =
      """
      You are StudyMind, a friendly study assistant. You help students understand topics,
      plan their learning and organize a personal library of folders, notes, documents,
      flashcards, audio clips and images. Answer clearly and concisely, use markdown where it
      helps, and ask a short follow-up question when the request is ambiguous.
      """;

  static final String UPDATE_NOT_SUPPORTED =
      "Updating library content is not supported yet. You can create new items instead.";
  static final String DELETE_NOT_SUPPORTED =
      "Deleting library content is not supported yet. You can remove items from the library"
          + " view.";

  private final ChatModel textChatModel;
  private final ContentAnalysisAgent contentAnalysisAgent;
  private final CreationConfirmationAgent creationConfirmationAgent;
  private final StudyMindConfig config;

  public ReplySynthesizerImpl(
      @Qualifier("textChatModel") ChatModel textChatModel,
      ContentAnalysisAgent contentAnalysisAgent,
      CreationConfirmationAgent creationConfirmationAgent,
      StudyMindConfig config) {
    this.textChatModel = textChatModel;
    this.contentAnalysisAgent = contentAnalysisAgent;
    this.creationConfirmationAgent = creationConfirmationAgent;
    this.config = config;
  }

  @Override
  @Timed(value = "pipeline.converse", description = "Time to generate a conversational reply")
  @CircuitBreaker(name = "openai", fallbackMethod = "converseFallback")
  public String converse(PipelineState state) {
    List<ChatMessage> messages = new ArrayList<>();
    String systemPrompt = SYSTEM_PROMPT;
    if (!state.getSummary().isBlank()) {
      systemPrompt += "\nConversation summary so far:\n" + MarkerParser.strip(state.getSummary());
    }
    messages.add(SystemMessage.from(systemPrompt));

    List<ChatTurn> turns = state.getPriorTurns();
    int windowSize = config.getConversation().getHistoryWindow();
    for (ChatTurn turn : turns.subList(Math.max(0, turns.size() - windowSize), turns.size())) {
      String text = MarkerParser.strip(turn.getMessage());
      if (text.isBlank()) {
        continue;
      }
      if (turn.getRole() == MessageRole.USER) {
        messages.add(UserMessage.from(text));
      } else {
        messages.add(AiMessage.from(text));
      }
    }
    messages.add(UserMessage.from(state.getUserMessage()));

    try {
      return textChatModel.chat(messages).aiMessage().text();
    } catch (RuntimeException e) {
      log.error("Conversation call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Conversation reply failed", e);
    }
  }

  @Override
  @Timed(value = "pipeline.analyze", description = "Time to analyze referenced content")
  @CircuitBreaker(name = "openai", fallbackMethod = "analyzeFallback")
  public String analyze(PipelineState state) {
    String content = describeContent(state.getReferences());
    try {
      return contentAnalysisAgent.analyze(state.getUserMessage(), state.getSummary(), content);
    } catch (RuntimeException e) {
      log.error("Content analysis call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Content analysis failed", e);
    }
  }

  @Override
  @Timed(value = "pipeline.synthesize", description = "Time to synthesize the final reply")
  public SynthesizedReply synthesize(PipelineState state) {
    Intent intent = state.getIntent();
    String stored =
        switch (intent) {
          case CREATE -> confirmCreation(state);
          case UPDATE -> UPDATE_NOT_SUPPORTED;
          case DELETE -> DELETE_NOT_SUPPORTED;
          default -> state.getResponse() == null ? "" : state.getResponse().trim();
        };
    return new SynthesizedReply(stored, MarkerParser.strip(stored));
  }

  private String confirmCreation(PipelineState state) {
    List<LibraryItem> items = state.getMaterialized();
    String itemList =
        items.stream()
            .map(item -> "- " + item.getType() + ": " + item.getName())
            .collect(Collectors.joining("\n"));
    String confirmation;
    try {
      confirmation = creationConfirmationAgent.confirm(state.getUserMessage(), itemList);
    } catch (RuntimeException e) {
      log.error("Creation confirmation call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Creation confirmation failed", e);
    }

    // Model output must not smuggle in markers of its own
    String prose = MarkerParser.strip(confirmation == null ? "" : confirmation);
    String markers =
        items.stream()
            .map(
                item ->
                    MarkerParser.format(
                        MarkerKind.CREATED,
                        item.getUid().toString(),
                        item.getName(),
                        item.getType().name()))
            .collect(Collectors.joining("\n"));
    return prose.isBlank() ? markers : prose + "\n\n" + markers;
  }

  private static String describeContent(List<Reference> references) {
    if (references.isEmpty()) {
      return "(no library items were found for this request)";
    }
    return references.stream()
        .map(
            r ->
                "### "
                    + r.name()
                    + " ("
                    + r.type()
                    + ")\n"
                    + (r.content().isBlank() ? "(content not loaded)" : r.content()))
        .collect(Collectors.joining("\n\n"));
  }

  @SuppressWarnings("unused")
  private String converseFallback(PipelineState state, CallNotPermittedException e) {
    log.warn("Conversational reply circuit open: {}", e.getMessage());
    throw new LlmServiceException("Conversational reply is unavailable", e);
  }

  @SuppressWarnings("unused")
  private String analyzeFallback(PipelineState state, CallNotPermittedException e) {
    log.warn("Content analysis circuit open: {}", e.getMessage());
    throw new LlmServiceException("Content analysis is unavailable", e);
  }
}
