package com.flamingo.ai.studymind.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent writing the short message that announces newly created library items. */
public interface CreationConfirmationAgent {

  @SystemMessage(
      """
        You are an upbeat study assistant. Tell the student, in two or three sentences, what
        you just added to their library, naming each item. Suggest one way to use the new
        material. Do not use lists or headings.
        """)
  @UserMessage(
      """
        Request: {{message}}

        Created items:
        {{items}}
        """)
  String confirm(@V("message") String message, @V("items") String items);
}
