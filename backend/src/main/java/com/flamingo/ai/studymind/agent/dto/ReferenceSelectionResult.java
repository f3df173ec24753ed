package com.flamingo.ai.studymind.agent.dto;

import java.util.List;

/** Structured output from ReferenceSelectionAgent. */
public record ReferenceSelectionResult(List<ReferenceSelection> references) {}
