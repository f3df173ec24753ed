package com.flamingo.ai.studymind.agent;

import com.flamingo.ai.studymind.agent.dto.ContentEnrichmentResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent filling the type-specific content of one planned library item. */
public interface ContentEnrichmentAgent {

  @SystemMessage(
      """
        You design a folder for a student's study library. Pick a pastel hex color such as
        "#A8C686" and one icon from: book, folder, document, note, flashcard, audio, video,
        image, science, math, history, language, art, music, sports, computer.

        Return ONLY valid JSON: {"color": "#RRGGBB", "icon": "..."}
        """)
  @UserMessage(
      """
        Folder name: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichFolder(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You write study notes. Write well-structured markdown notes (max 1000 words) that
        teach the topic clearly, plus a one-sentence description.

        Return ONLY valid JSON: {"description": "...", "notes": "markdown"}
        """)
  @UserMessage(
      """
        Note title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichNote(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You write flashcards for active recall. Write between 5 and 10 cards, each with a
        precise question and a concise answer, plus a one-sentence description of the deck.

        Return ONLY valid JSON:
        {"description": "...", "cards": [{"question": "...", "answer": "..."}]}
        """)
  @UserMessage(
      """
        Deck title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichFlashcard(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You prepare a study document that will be rendered to PDF. Write the full document
        body as markdown (max 200 words) in "prompt", plus a one-sentence description.

        Return ONLY valid JSON: {"description": "...", "prompt": "markdown"}
        """)
  @UserMessage(
      """
        Document title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichDocument(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You prepare an audio lesson that will be read aloud by a text-to-speech voice. Write
        the spoken script (max 100 words, no markdown) in "prompt", an estimated duration in
        seconds in "duration", plus a one-sentence description.

        Return ONLY valid JSON: {"description": "...", "duration": 45, "prompt": "..."}
        """)
  @UserMessage(
      """
        Audio title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichAudio(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You prepare a short educational video. Write the video script (max 100 words) in
        "prompt", an estimated duration in seconds in "duration", plus a one-sentence
        description.

        Return ONLY valid JSON: {"description": "...", "duration": 60, "prompt": "..."}
        """)
  @UserMessage(
      """
        Video title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichVideo(
      @V("name") String name, @V("request") String request, @V("context") String context);

  @SystemMessage(
      """
        You prepare an educational illustration for an image generator. Write a vivid image
        description (max 20 words) in "prompt", a resolution formatted WIDTHxHEIGHT such as
        "1024x1024" in "resolution", plus a one-sentence description.

        Return ONLY valid JSON: {"description": "...", "resolution": "1024x1024", "prompt": "..."}
        """)
  @UserMessage(
      """
        Image title: {{name}}
        Request: {{request}}
        Context: {{context}}
        """)
  ContentEnrichmentResult enrichImage(
      @V("name") String name, @V("request") String request, @V("context") String context);
}
