package com.flamingo.ai.studymind.service.reference;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.service.marker.MarkerKind;
import java.util.UUID;

/**
 * A library item resolved for the current request. Lives for one pipeline run only.
 *
 * @param content the item's textual content, empty for shallow references
 * @param purpose why the item was fetched, used to steer later prompts
 * @param source whether the user mentioned the item or the assistant created it earlier
 */
public record Reference(
    Long itemId,
    UUID uid,
    String name,
    LibraryItemType type,
    Long parentId,
    boolean needContent,
    String content,
    String purpose,
    MarkerKind source) {}
