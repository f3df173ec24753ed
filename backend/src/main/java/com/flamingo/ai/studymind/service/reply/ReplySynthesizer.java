package com.flamingo.ai.studymind.service.reply;

import com.flamingo.ai.studymind.service.orchestrator.PipelineState;

/** Produces the assistant's side of a chat turn. */
public interface ReplySynthesizer {

  /**
   * Chats over the system prompt, the recent turns and the current message.
   *
   * @return the response text
   */
  String converse(PipelineState state);

  /**
   * Answers the current message from the contents of the resolved references.
   *
   * @return the response text
   */
  String analyze(PipelineState state);

  /**
   * Builds the final reply for the classified intent. For creations the stored message carries
   * one {@code @created} marker per materialized item.
   */
  SynthesizedReply synthesize(PipelineState state);
}
