package com.flamingo.ai.studymind.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import com.flamingo.ai.studymind.domain.metadata.FlashcardMetadata;
import com.flamingo.ai.studymind.domain.metadata.ImageMetadata;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import java.util.List;
import org.junit.jupiter.api.Test;

class LibraryItemMetadataConverterTest {

  private final LibraryItemMetadataConverter converter = new LibraryItemMetadataConverter();

  @Test
  void shouldTagJsonWithItemType() {
    // Given
    ImageMetadata image =
        new ImageMetadata("Cell", "png", "d/cell.png", "http://x/d/cell.png", 12L, "512x512");

    // When
    String json = converter.convertToDatabaseColumn(image);

    // Then
    assertThat(json).contains("\"type\":\"IMAGE\"").contains("\"resolution\":\"512x512\"");
    assertThat(converter.convertToEntityAttribute(json)).isEqualTo(image);
  }

  @Test
  void shouldRestoreFlashcardDeck() {
    // Given
    String json =
        "{\"type\":\"FLASHCARD\",\"description\":\"Cells\",\"cards\":"
            + "[{\"question\":\"What is ATP?\",\"answer\":\"Energy\"}],\"cardCount\":1}";

    // When
    LibraryItemMetadata metadata = converter.convertToEntityAttribute(json);

    // Then
    assertThat(metadata)
        .isEqualTo(
            new FlashcardMetadata("Cells", List.of(new Flashcard("What is ATP?", "Energy")), 1));
  }

  @Test
  void shouldIgnoreUnknownFields_andHandleEmptyColumns() {
    assertThat(
            converter.convertToEntityAttribute(
                "{\"type\":\"FOLDER\",\"color\":\"#000000\",\"icon\":\"book\",\"legacy\":1}"))
        .isNotNull();
    assertThat(converter.convertToEntityAttribute(null)).isNull();
    assertThat(converter.convertToEntityAttribute(" ")).isNull();
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
  }

  @Test
  void shouldReturnNull_whenColumnIsCorrupt() {
    assertThat(converter.convertToEntityAttribute("{not json")).isNull();
  }
}
