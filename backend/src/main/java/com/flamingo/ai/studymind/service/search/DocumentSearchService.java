package com.flamingo.ai.studymind.service.search;

import java.util.UUID;

/** Retrieves the passages of a stored document that are relevant to a query. */
public interface DocumentSearchService {

  /**
   * Searches within one library item.
   *
   * @param itemUid external uid of the DOCUMENT item
   * @param query what the caller is looking for
   * @param topK maximum number of passages
   * @return the passages joined in rank order; empty when nothing matches
   */
  String search(UUID itemUid, String query, int topK);
}
