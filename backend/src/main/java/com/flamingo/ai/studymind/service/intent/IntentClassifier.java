package com.flamingo.ai.studymind.service.intent;

/** Decides what kind of action a chat message asks for. */
public interface IntentClassifier {

  /**
   * Classifies the latest user message.
   *
   * @param message the latest user message, markers included
   * @param summary rolling digest of the conversation, may be empty
   * @return the intent plus a derived session title and description
   * @throws com.flamingo.ai.studymind.exception.IntentClassificationException when no valid intent
   *     can be derived
   */
  ClassifiedIntent classify(String message, String summary);
}
