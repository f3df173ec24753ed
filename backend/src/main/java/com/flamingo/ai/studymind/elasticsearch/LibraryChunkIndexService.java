package com.flamingo.ai.studymind.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link LibraryChunk} documents.
 *
 * <p>Every search is scoped to one library item through the {@code libraryItemId} keyword field.
 */
@Service
@Slf4j
public class LibraryChunkIndexService extends AbstractElasticsearchIndexService<LibraryChunk> {

  public static final String ITEM_FIELD = "libraryItemId";

  @Value("${app.elasticsearch.index-name:studymind-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public LibraryChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public LibraryChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // keyword type so the item filter is an exact match
    properties.put(ITEM_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put("fileName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "content", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected LibraryChunk convertFromDocument(Map<String, Object> source) {
    Object chunkIndex = source.get("chunkIndex");
    return LibraryChunk.builder()
        .id((String) source.get("id"))
        .libraryItemId((String) source.get(ITEM_FIELD))
        .fileName((String) source.get("fileName"))
        .chunkIndex(chunkIndex instanceof Number n ? n.intValue() : 0)
        .content((String) source.get("content"))
        .build();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    String itemId = requireItemId(filterCriteria);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(topK * 2)
                            .filter(f -> f.term(t -> t.field(ITEM_FIELD).value(itemId))))
                .size(topK));
  }

  @Override
  protected SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK) {
    String itemId = requireItemId(filterCriteria);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.filter(f -> f.term(t -> t.field(ITEM_FIELD).value(itemId)))
                                    .must(
                                        m ->
                                            m.multiMatch(
                                                mm ->
                                                    mm.fields("content")
                                                        .query(query)
                                                        .type(TextQueryType.BestFields)))))
                .size(topK));
  }

  @Override
  protected String getMetricPrefix() {
    return "library_chunk";
  }

  /**
   * Builds the filter criteria that scope a search to one library item.
   *
   * @param itemUid external uid of the library item
   * @return criteria for {@link #vectorSearch} and {@link #keywordSearch}
   */
  public static Map<String, Object> criteriaFor(UUID itemUid) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(ITEM_FIELD, itemUid);
    return criteria;
  }

  private static String requireItemId(Map<String, Object> filterCriteria) {
    Object itemId = filterCriteria.get(ITEM_FIELD);
    if (itemId == null) {
      throw new IllegalArgumentException(ITEM_FIELD + " filter is required for search");
    }
    return itemId.toString();
  }
}
