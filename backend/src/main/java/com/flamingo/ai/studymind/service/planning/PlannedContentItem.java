package com.flamingo.ai.studymind.service.planning;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;

/**
 * One unit of work in the creation queue.
 *
 * @param metadata type-specific draft, completed by the materializer
 * @param prompt rendering input, required for rendered types and null otherwise
 */
public record PlannedContentItem(
    String name,
    LibraryItemType type,
    ParentRef parent,
    LibraryItemMetadata metadata,
    String prompt) {}
