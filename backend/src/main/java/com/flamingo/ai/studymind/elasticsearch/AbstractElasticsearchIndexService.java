package com.flamingo.ai.studymind.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides index bootstrap plus filtered vector and keyword search. Subclasses define the
 * schema, the request builders and the conversion from {@code _source}.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts an Elasticsearch document map to a document entity.
   *
   * @param source the Elasticsearch document map, with {@code id} injected from the hit
   * @return the document entity
   */
  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  protected abstract SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK);

  /**
   * Returns the metric prefix for this index (e.g., "library_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        Map<String, Property> properties = defineIndexProperties();
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(getIndexName())
                        .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        log.debug("Elasticsearch index '{}' already exists", getIndexName());
      }
    } catch (Exception e) {
      // Search is optional for the pipeline; reads degrade to empty results.
      log.warn(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage());
      meterRegistry.counter(getMetricPrefix() + ".init.failure").increment();
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug("[vectorSearch] index={} returned={}", getIndexName(), results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK) {
    try {
      SearchRequest request = buildKeywordSearchRequest(filterCriteria, query, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug(
          "[keywordSearch] index={} query='{}' returned={}",
          getIndexName(),
          query,
          results.size());
      meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Keyword search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Keyword search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> keywordSearchFallback(
      Map<String, Object> filterCriteria, String query, int topK, Throwable t) {
    log.warn("{} keyword search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is hit metadata, not part of _source
        source.put("id", hit.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }
}
