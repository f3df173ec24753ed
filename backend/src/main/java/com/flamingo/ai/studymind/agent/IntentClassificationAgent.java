package com.flamingo.ai.studymind.agent;

import com.flamingo.ai.studymind.agent.dto.IntentClassificationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent deciding what kind of action a chat message asks for. */
public interface IntentClassificationAgent {

  @SystemMessage(
      """
        You are the request router of a study assistant that manages a personal library of
        folders, notes, documents, flashcards, audio clips, videos and images.

        Classify the user's latest message into exactly ONE intent:
        - CONVERSE: general chat, questions or explanations that need no library action
        - CREATE: the user wants new library content (folders, notes, documents, flashcards,
          audio, video, images), including putting new content inside existing folders
        - READ: the user wants existing library content analyzed, explained, summarized or
          compared
        - UPDATE: the user wants existing content renamed, moved or edited
        - DELETE: the user wants existing content removed

        Also derive:
        - title: a short session title (max 6 words) describing the conversation topic
        - description: one sentence describing what the user is working on

        Return ONLY valid JSON:
        {"intent": "CONVERSE|CREATE|READ|UPDATE|DELETE", "title": "...", "description": "..."}
        """)
  @UserMessage(
      """
        Conversation summary so far:
        {{summary}}

        Latest user message:
        {{message}}
        """)
  IntentClassificationResult classify(
      @V("message") String message, @V("summary") String summary);
}
