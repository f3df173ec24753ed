package com.flamingo.ai.studymind.config;

import com.flamingo.ai.studymind.agent.ContentAnalysisAgent;
import com.flamingo.ai.studymind.agent.ContentEnrichmentAgent;
import com.flamingo.ai.studymind.agent.ContentPlanningAgent;
import com.flamingo.ai.studymind.agent.CreationConfirmationAgent;
import com.flamingo.ai.studymind.agent.FlashcardGenerationAgent;
import com.flamingo.ai.studymind.agent.IntentClassificationAgent;
import com.flamingo.ai.studymind.agent.ReferenceSelectionAgent;
import com.flamingo.ai.studymind.agent.SessionSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for reusable AI agents using LangChain4j AI Services.
 *
 * <p>Agents returning records are bound to the JSON-mode {@code chatModel}; agents returning prose
 * are bound to {@code textChatModel}.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public IntentClassificationAgent intentClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(IntentClassificationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ReferenceSelectionAgent referenceSelectionAgent(ChatModel chatModel) {
    return AiServices.builder(ReferenceSelectionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ContentPlanningAgent contentPlanningAgent(ChatModel chatModel) {
    return AiServices.builder(ContentPlanningAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ContentEnrichmentAgent contentEnrichmentAgent(ChatModel chatModel) {
    return AiServices.builder(ContentEnrichmentAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public FlashcardGenerationAgent flashcardGenerationAgent(ChatModel chatModel) {
    return AiServices.builder(FlashcardGenerationAgent.class).chatModel(chatModel).build();
  }

  /** Session summary agent. Uses textChatModel (no JSON response format) for free-form text. */
  @Bean
  public SessionSummaryAgent sessionSummaryAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(SessionSummaryAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public ContentAnalysisAgent contentAnalysisAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ContentAnalysisAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public CreationConfirmationAgent creationConfirmationAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(CreationConfirmationAgent.class).chatModel(textChatModel).build();
  }
}
