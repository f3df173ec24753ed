package com.flamingo.ai.studymind.domain.metadata;

import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import java.util.List;
import java.util.regex.Pattern;

/** Presentation attributes of a folder. */
public record FolderMetadata(String color, String icon) implements LibraryItemMetadata {

  public static final String DEFAULT_COLOR = "#A8C686";
  public static final String DEFAULT_ICON = "folder";

  public static final List<String> ICONS =
      List.of(
          "book", "folder", "document", "note", "flashcard", "audio", "video", "image", "science",
          "math", "history", "language", "art", "music", "sports", "computer");

  private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

  @Override
  public LibraryItemType itemType() {
    return LibraryItemType.FOLDER;
  }

  /** Returns a copy whose color is a hex code and whose icon is one of {@link #ICONS}. */
  public FolderMetadata normalized() {
    String safeColor =
        color != null && HEX_COLOR.matcher(color.trim()).matches() ? color.trim() : DEFAULT_COLOR;
    String safeIcon =
        icon != null && ICONS.contains(icon.trim().toLowerCase())
            ? icon.trim().toLowerCase()
            : DEFAULT_ICON;
    return new FolderMetadata(safeColor, safeIcon);
  }
}
