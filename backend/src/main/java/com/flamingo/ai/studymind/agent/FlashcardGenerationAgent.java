package com.flamingo.ai.studymind.agent;

import com.flamingo.ai.studymind.agent.dto.FlashcardSet;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent writing the cards of a flashcard deck whose plan left them empty. */
public interface FlashcardGenerationAgent {

  @SystemMessage(
      """
        You write flashcards for active recall. Each card has a precise question and a concise
        answer. Cover the most important facts of the topic without repeating yourself.

        Return ONLY valid JSON: {"cards": [{"question": "...", "answer": "..."}]}
        """)
  @UserMessage(
      """
        Write between {{minCards}} and {{maxCards}} flashcards.

        Deck title: {{name}}
        Deck description: {{description}}
        """)
  FlashcardSet generate(
      @V("name") String name,
      @V("description") String description,
      @V("minCards") int minCards,
      @V("maxCards") int maxCards);
}
