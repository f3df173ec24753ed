package com.flamingo.ai.studymind.agent.dto;

import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import java.util.List;

/** Structured output from FlashcardGenerationAgent. */
public record FlashcardSet(List<Flashcard> cards) {}
