package com.flamingo.ai.studymind.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymind.elasticsearch.LibraryChunk;
import com.flamingo.ai.studymind.elasticsearch.LibraryChunkIndexService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HybridDocumentSearchServiceTest {

  private static final UUID ITEM_UID = UUID.randomUUID();

  @Mock private LibraryChunkIndexService libraryChunkIndexService;
  @Mock private EmbeddingService embeddingService;

  private HybridDocumentSearchService searchService;

  @BeforeEach
  void setUp() {
    searchService = new HybridDocumentSearchService(libraryChunkIndexService, embeddingService);
  }

  @Test
  void shouldRankChunksFoundByBothRetrieversFirst() {
    // Given
    LibraryChunk a = chunk("a", "Alleles");
    LibraryChunk b = chunk("b", "Dominance");
    LibraryChunk c = chunk("c", "Meiosis");

    // When
    List<LibraryChunk> fused = searchService.applyRrf(List.of(a, b), List.of(b, c), 3);

    // Then
    assertThat(fused).extracting(LibraryChunk::getId).containsExactly("b", "a", "c");
  }

  @Test
  void shouldLimitFusedResultsToTopK() {
    // When
    List<LibraryChunk> fused =
        searchService.applyRrf(
            List.of(chunk("a", "1"), chunk("b", "2")), List.of(chunk("c", "3")), 2);

    // Then
    assertThat(fused).hasSize(2);
  }

  @Test
  void shouldScopeSearchToItem_andJoinPassages() {
    // Given
    List<Float> embedding = List.of(0.1f, 0.2f);
    when(embeddingService.embedQuery("dominant alleles")).thenReturn(embedding);
    when(libraryChunkIndexService.vectorSearch(anyMap(), eq(embedding), eq(5)))
        .thenReturn(List.of(chunk("a", "Alleles are variants."), chunk("b", " ")));
    when(libraryChunkIndexService.keywordSearch(anyMap(), eq("dominant alleles"), eq(5)))
        .thenReturn(List.of(chunk("a", "Alleles are variants."), chunk("c", "Dominance.")));

    // When
    String passages = searchService.search(ITEM_UID, "dominant alleles", 5);

    // Then
    assertThat(passages).isEqualTo("Alleles are variants.\n\n---\n\nDominance.");
    verify(libraryChunkIndexService)
        .keywordSearch(
            eq(Map.of(LibraryChunkIndexService.ITEM_FIELD, ITEM_UID)),
            eq("dominant alleles"),
            eq(5));
  }

  @Test
  void shouldFallBackToKeywordSearch_whenEmbeddingUnavailable() {
    // Given
    when(embeddingService.embedQuery("photosynthesis")).thenReturn(List.of());
    when(libraryChunkIndexService.keywordSearch(anyMap(), eq("photosynthesis"), eq(3)))
        .thenReturn(List.of(chunk("k", "Light reactions.")));

    // When
    String passages = searchService.search(ITEM_UID, "photosynthesis", 3);

    // Then
    assertThat(passages).isEqualTo("Light reactions.");
    verify(libraryChunkIndexService, never()).vectorSearch(any(), anyList(), anyInt());
  }

  @Test
  void shouldReturnEmptyText_whenNothingMatches() {
    // Given
    when(embeddingService.embedQuery("nothing")).thenReturn(List.of());
    when(libraryChunkIndexService.keywordSearch(anyMap(), eq("nothing"), eq(5)))
        .thenReturn(List.of());

    // When / Then
    assertThat(searchService.search(ITEM_UID, "nothing", 5)).isEmpty();
  }

  private static LibraryChunk chunk(String id, String content) {
    return LibraryChunk.builder()
        .id(id)
        .libraryItemId(ITEM_UID.toString())
        .chunkIndex(0)
        .content(content)
        .build();
  }
}
