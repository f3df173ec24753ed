package com.flamingo.ai.studymind.service.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the inline reference micro-format used in chat messages.
 *
 * <pre>
 * &#64;mention {uid: '3f0c...', name: 'Bio Notes', type: 'NOTE'}
 * &#64;created {uid: '9a1e...', name: 'Biology', type: 'FOLDER'}
 * </pre>
 *
 * <p>Values may be wrapped in single or double quotes and may contain braces. A marker without a
 * {@code uid} field is ignored. No other class knows this grammar.
 */
public final class MarkerParser {

  private static final Pattern MARKER =
      Pattern.compile("@(mention|created)\\s*\\{((?:[^{}'\"]|'[^']*'|\"[^\"]*\")*)}");
  private static final Pattern FIELD = Pattern.compile("(\\w+)\\s*:\\s*(['\"])(.*?)\\2");

  private MarkerParser() {}

  /**
   * Parses every well-formed marker in the text, in order of appearance.
   *
   * @param text message text, may be null
   * @return the markers found, empty when none
   */
  public static List<InlineMarker> parse(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<InlineMarker> markers = new ArrayList<>();
    Matcher matcher = MARKER.matcher(text);
    while (matcher.find()) {
      Map<String, String> fields = parseFields(matcher.group(2));
      String uid = fields.get("uid");
      if (uid == null || uid.isBlank()) {
        continue;
      }
      markers.add(
          new InlineMarker(
              MarkerKind.fromKeyword(matcher.group(1)),
              uid.trim(),
              Collections.unmodifiableMap(fields),
              matcher.group()));
    }
    return markers;
  }

  /** Formats a marker. Double quotes are used for any value that contains a single quote. */
  public static String format(MarkerKind kind, String uid, String name, String type) {
    return "@"
        + kind.keyword()
        + " {uid: "
        + quote(uid)
        + ", name: "
        + quote(name)
        + ", type: "
        + quote(type)
        + "}";
  }

  /** Removes all markers from the text and tidies the whitespace they leave behind. */
  public static String strip(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String stripped = MARKER.matcher(text).replaceAll("");
    return stripped
        .replaceAll("[ \\t]+\\n", "\n")
        .replaceAll("[ \\t]{2,}", " ")
        .replaceAll("\\n{3,}", "\n\n")
        .trim();
  }

  private static Map<String, String> parseFields(String body) {
    Map<String, String> fields = new LinkedHashMap<>();
    Matcher matcher = FIELD.matcher(body);
    while (matcher.find()) {
      fields.putIfAbsent(matcher.group(1), matcher.group(3));
    }
    return fields;
  }

  private static String quote(String value) {
    String safe = value == null ? "" : value.replace("\n", " ");
    if (safe.contains("'")) {
      return "\"" + safe.replace("\"", "") + "\"";
    }
    return "'" + safe + "'";
  }
}
