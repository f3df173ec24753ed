package com.flamingo.ai.studymind.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A chunk of a library item's extracted text, stored with its vector embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LibraryChunk {

  private String id;

  /** External uid of the owning library item. */
  private String libraryItemId;

  private String fileName;
  private int chunkIndex;
  private String content;
  private List<Float> embedding;
}
