package com.flamingo.ai.studymind.agent;

import com.flamingo.ai.studymind.agent.dto.ContentPlanResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent producing the ordered list of library items a creation request implies.
 *
 * <p>The plan is structural only (name, type, placement). Type-specific content is filled in
 * afterwards by {@link ContentEnrichmentAgent}.
 */
public interface ContentPlanningAgent {

  @SystemMessage(
      """
        You plan new content for a student's study library. The library is a tree of items of
        type FOLDER, NOTE, DOCUMENT, FLASHCARD, AUDIO, VIDEO or IMAGE.

        Produce EXACTLY the items the request asks for, in creation order. Never add extra
        items the user did not ask for. Parents must come before their children.

        Choose each item's parentId with these rules, first match wins:
        1. The user wants the item inside a referenced existing folder: use that folder's id.
        2. The request relates to a referenced item's location: use that item's parentId.
        3. The parent is a folder being created in this same plan: give the new folder
           parentId 0 (or a rule 1/2 id) and give each item that goes inside it parentId -1.
           -1 means "inside the item created right before me", so list a new folder directly
           followed by its contents.
        4. Otherwise use 0 (library root).

        Names must be short and descriptive. Types must be one of the listed values.

        Return ONLY valid JSON:
        {"items": [{"name": "...", "type": "FOLDER", "parentId": 0}]}
        """)
  @UserMessage(
      """
        Conversation summary:
        {{summary}}

        Referenced items (id, parentId, type, name, purpose):
        {{references}}

        Request:
        {{message}}
        """)
  ContentPlanResult plan(
      @V("message") String message,
      @V("summary") String summary,
      @V("references") String references);
}
