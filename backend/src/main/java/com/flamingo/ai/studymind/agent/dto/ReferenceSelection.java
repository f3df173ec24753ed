package com.flamingo.ai.studymind.agent.dto;

/** One candidate reference as judged by ReferenceSelectionAgent. */
public record ReferenceSelection(String uid, boolean needContent, String purpose) {}
