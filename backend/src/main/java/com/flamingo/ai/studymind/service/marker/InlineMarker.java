package com.flamingo.ai.studymind.service.marker;

import java.util.Map;

/**
 * A marker parsed out of message text.
 *
 * @param kind mention or created
 * @param uid the referenced item uid, as written
 * @param rawFields every key/value pair found inside the braces
 * @param literal the exact marker text as it appeared in the message
 */
public record InlineMarker(
    MarkerKind kind, String uid, Map<String, String> rawFields, String literal) {

  public String name() {
    return rawFields.getOrDefault("name", "");
  }

  public String type() {
    return rawFields.getOrDefault("type", "");
  }
}
