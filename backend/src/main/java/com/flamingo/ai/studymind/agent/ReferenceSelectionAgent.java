package com.flamingo.ai.studymind.agent;

import com.flamingo.ai.studymind.agent.dto.ReferenceSelectionResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent deciding which referenced library items a request needs, and how deeply. */
public interface ReferenceSelectionAgent {

  @SystemMessage(
      """
        You help a study assistant decide which library items a user request depends on.

        You receive candidate items. Each one was either mentioned by the user or created by
        the assistant earlier in the conversation. For every candidate that matters to the
        latest message return:
        - uid: the candidate uid, copied exactly
        - needContent: true when the item's body must be read (summarize, explain, quiz on,
          compare, build new material from it); false when only its identity is needed (use a
          folder as the destination, place something next to an item)
        - purpose: a short phrase saying why the item is needed, e.g. "parent folder for new
          notes" or "source material for flashcards"

        Leave out candidates that do not matter to the latest message. When several
        candidates serve the same purpose keep only the most recent one.

        Return ONLY valid JSON:
        {"references": [{"uid": "...", "needContent": true, "purpose": "..."}]}
        """)
  @UserMessage(
      """
        Conversation summary:
        {{summary}}

        Candidate items (oldest first):
        {{candidates}}

        Latest user message:
        {{message}}
        """)
  ReferenceSelectionResult select(
      @V("message") String message,
      @V("summary") String summary,
      @V("candidates") String candidates);
}
