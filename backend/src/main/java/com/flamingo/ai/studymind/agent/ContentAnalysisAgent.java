package com.flamingo.ai.studymind.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent answering questions about library items the user referenced. */
public interface ContentAnalysisAgent {

  @SystemMessage(
      """
        You are a patient tutor. Answer the student's request using the provided library
        content. Quote or cite the relevant parts by item name. When the content does not
        cover the request, say so instead of guessing. Use markdown where it helps.
        """)
  @UserMessage(
      """
        Conversation summary:
        {{summary}}

        Library content:
        {{content}}

        Student request:
        {{message}}
        """)
  String analyze(
      @V("message") String message, @V("summary") String summary, @V("content") String content);
}
