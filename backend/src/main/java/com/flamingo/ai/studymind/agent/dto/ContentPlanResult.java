package com.flamingo.ai.studymind.agent.dto;

import java.util.List;

/** Structured output from ContentPlanningAgent. */
public record ContentPlanResult(List<PlannedItemDraft> items) {}
