package com.flamingo.ai.studymind.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic read-side interface for Elasticsearch indices.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Performs vector similarity search with filters.
   *
   * @param filterCriteria key-value pairs for filtering (e.g., libraryItemId)
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return list of matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Performs keyword search with filters.
   *
   * @param filterCriteria key-value pairs for filtering (e.g., libraryItemId)
   * @param query the search query text
   * @param topK number of results to return
   * @return list of matching documents ordered by relevance
   */
  List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK);

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
