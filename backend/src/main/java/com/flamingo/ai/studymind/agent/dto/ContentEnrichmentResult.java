package com.flamingo.ai.studymind.agent.dto;

import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import java.util.List;

/**
 * Structured output from ContentEnrichmentAgent. Each enrichment method fills only the fields
 * relevant to its item type; the rest stay null.
 */
public record ContentEnrichmentResult(
    String description,
    String notes,
    String color,
    String icon,
    List<Flashcard> cards,
    Integer duration,
    String resolution,
    String prompt) {}
