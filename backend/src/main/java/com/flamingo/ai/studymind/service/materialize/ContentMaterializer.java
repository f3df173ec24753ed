package com.flamingo.ai.studymind.service.materialize;

import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.service.orchestrator.PipelineState;

/** Turns the planned item at the pipeline cursor into a stored library item. */
public interface ContentMaterializer {

  /**
   * Renders, stores and records the item at the cursor. On success the item is appended to the
   * materialized list and the cursor advances by one.
   *
   * @param state the running pipeline, with at least one pending item
   * @return the stored item
   */
  LibraryItem materializeNext(PipelineState state);
}
