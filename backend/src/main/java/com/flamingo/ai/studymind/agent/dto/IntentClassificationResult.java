package com.flamingo.ai.studymind.agent.dto;

/**
 * Structured output from IntentClassificationAgent. The intent label is validated by the caller,
 * the model is not trusted to stay within the allowed set.
 */
public record IntentClassificationResult(String intent, String title, String description) {}
