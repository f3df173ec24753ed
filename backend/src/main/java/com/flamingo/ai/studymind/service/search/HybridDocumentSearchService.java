package com.flamingo.ai.studymind.service.search;

import com.flamingo.ai.studymind.elasticsearch.LibraryChunk;
import com.flamingo.ai.studymind.elasticsearch.LibraryChunkIndexService;
import io.micrometer.core.annotation.Timed;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid search combining kNN vector search and BM25 keyword search with application-side
 * Reciprocal Rank Fusion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridDocumentSearchService implements DocumentSearchService {

  static final int RRF_K = 60;
  static final String PASSAGE_SEPARATOR = "\n\n---\n\n";

  private final LibraryChunkIndexService libraryChunkIndexService;
  private final EmbeddingService embeddingService;

  @Override
  @Timed(value = "search.document", description = "Time for hybrid document search")
  public String search(UUID itemUid, String query, int topK) {
    Map<String, Object> criteria = LibraryChunkIndexService.criteriaFor(itemUid);

    List<Float> embedding = embeddingService.embedQuery(query);
    List<LibraryChunk> vectorResults =
        embedding.isEmpty()
            ? List.of()
            : libraryChunkIndexService.vectorSearch(criteria, embedding, topK);
    List<LibraryChunk> keywordResults =
        libraryChunkIndexService.keywordSearch(criteria, query, topK);

    List<LibraryChunk> fused = applyRrf(vectorResults, keywordResults, topK);
    log.debug(
        "Document search for item {}: vector={} keyword={} fused={}",
        itemUid,
        vectorResults.size(),
        keywordResults.size(),
        fused.size());

    return fused.stream()
        .map(LibraryChunk::getContent)
        .filter(content -> content != null && !content.isBlank())
        .collect(Collectors.joining(PASSAGE_SEPARATOR));
  }

  /** RRF score = sum of 1/(k + rank) over the retrievers that returned the chunk. */
  List<LibraryChunk> applyRrf(
      List<LibraryChunk> vectorResults, List<LibraryChunk> keywordResults, int topK) {
    Map<String, Double> scores = new HashMap<>();
    Map<String, LibraryChunk> chunks = new LinkedHashMap<>();
    accumulate(vectorResults, scores, chunks);
    accumulate(keywordResults, scores, chunks);

    return scores.entrySet().stream()
        .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
        .limit(topK)
        .map(entry -> chunks.get(entry.getKey()))
        .collect(Collectors.toList());
  }

  private static void accumulate(
      List<LibraryChunk> results, Map<String, Double> scores, Map<String, LibraryChunk> chunks) {
    for (int i = 0; i < results.size(); i++) {
      LibraryChunk chunk = results.get(i);
      String key =
          chunk.getId() != null
              ? chunk.getId()
              : chunk.getLibraryItemId() + "#" + chunk.getChunkIndex();
      scores.merge(key, 1.0 / (RRF_K + i + 1), Double::sum);
      chunks.putIfAbsent(key, chunk);
    }
  }
}
