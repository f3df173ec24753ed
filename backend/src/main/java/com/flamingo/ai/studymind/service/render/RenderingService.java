package com.flamingo.ai.studymind.service.render;

import com.flamingo.ai.studymind.service.storage.StoredArtifact;

/** Service interface turning generation prompts into stored files. */
public interface RenderingService {

  /**
   * Renders a markdown document to PDF.
   *
   * @param name target item name, used for the file name
   * @param markdown document body
   * @return the stored PDF
   */
  StoredArtifact renderDocument(String name, String markdown);

  /**
   * Renders a script to speech.
   *
   * @param name target item name, used for the file name
   * @param script text to read aloud
   * @return the stored MP3
   */
  StoredArtifact renderAudio(String name, String script);

  /**
   * Renders an image description.
   *
   * @param name target item name, used for the file name
   * @param description image prompt
   * @param width pixel width
   * @param height pixel height
   * @return the stored PNG
   */
  StoredArtifact renderImage(String name, String description, int width, int height);
}
