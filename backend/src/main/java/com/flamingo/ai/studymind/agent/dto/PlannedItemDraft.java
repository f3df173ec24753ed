package com.flamingo.ai.studymind.agent.dto;

/**
 * One entry of a structural content plan.
 *
 * <p>{@code parentId} follows the planner prompt contract: {@code null} or {@code 0} for root,
 * {@code -1} for "the item created right before me", any positive value for an existing item.
 */
public record PlannedItemDraft(String name, String type, Long parentId) {}
