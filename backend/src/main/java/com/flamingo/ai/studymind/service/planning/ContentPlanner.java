package com.flamingo.ai.studymind.service.planning;

import com.flamingo.ai.studymind.service.reference.Reference;
import java.util.List;

/** Turns a creation request into an ordered queue of items to materialize. */
public interface ContentPlanner {

  /**
   * Plans the items a creation request implies, in creation order, with their metadata drafts.
   *
   * @param message the latest user message
   * @param summary rolling digest of the conversation
   * @param references resolved references, possibly empty
   * @return a non-empty queue
   * @throws com.flamingo.ai.studymind.exception.ContentPlanningException when no usable plan can
   *     be produced
   */
  List<PlannedContentItem> plan(String message, String summary, List<Reference> references);
}
