package com.flamingo.ai.studymind.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent condensing the recent conversation into a rolling digest used as context by every
 * later step of a chat request.
 */
public interface SessionSummaryAgent {

  @SystemMessage(
      """
        You summarize tutoring conversations between a student and a study assistant.

        Write a short digest (max 150 words) covering:
        - topics that were discussed
        - library items that were mentioned or created
        - open learning goals or unanswered questions

        Reference tags are machine-readable pointers to library items. Copy every tag from the
        list you are given character for character. Never reword, merge or shorten a tag and
        never write a tag that is not in the list.
        """)
  @UserMessage(
      """
        Reference tags to preserve verbatim:
        {{tags}}

        Conversation:
        {{conversation}}
        """)
  String summarize(@V("conversation") String conversation, @V("tags") String tags);
}
