package com.flamingo.ai.studymind.service.orchestrator;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.Intent;
import com.flamingo.ai.studymind.service.intent.ClassifiedIntent;
import com.flamingo.ai.studymind.service.planning.PlannedContentItem;
import com.flamingo.ai.studymind.service.reference.Reference;
import com.flamingo.ai.studymind.service.reply.SynthesizedReply;
import com.flamingo.ai.studymind.service.storage.StoredArtifact;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * Mutable context of one pipeline run. Created per request and never shared between threads.
 *
 * <p>The materialized list is append-only; the cursor only moves forward, one item per
 * materialization.
 */
@Getter
public class PipelineState {

  private final Long userId;
  private final UUID sessionUid;
  private final String userMessage;
  private final List<ChatTurn> priorTurns;
  private final ChatSession existingSession;

  @Setter private String summary = "";
  @Setter private ClassifiedIntent classification;
  @Setter private List<Reference> references = List.of();
  private List<PlannedContentItem> queue = List.of();
  private int cursor;
  private final List<LibraryItem> materialized = new ArrayList<>();
  private final List<StoredArtifact> uploads = new ArrayList<>();
  @Setter private String response;
  @Setter private SynthesizedReply reply;
  @Setter private ChatSession session;
  @Setter private PipelineStage stage = PipelineStage.CLASSIFYING;
  private Throwable error;

  public PipelineState(
      Long userId,
      UUID sessionUid,
      String userMessage,
      List<ChatTurn> priorTurns,
      ChatSession existingSession) {
    this.userId = userId;
    this.sessionUid = sessionUid;
    this.userMessage = userMessage;
    this.priorTurns = priorTurns == null ? List.of() : List.copyOf(priorTurns);
    this.existingSession = existingSession;
  }

  public Intent getIntent() {
    return classification != null ? classification.intent() : null;
  }

  /** Replaces the creation queue and rewinds the cursor. */
  public void setQueue(List<PlannedContentItem> queue) {
    this.queue = List.copyOf(queue);
    this.cursor = 0;
  }

  public boolean hasPendingItems() {
    return cursor < queue.size();
  }

  /** The queue entry at the cursor. */
  public PlannedContentItem currentItem() {
    if (!hasPendingItems()) {
      throw new IllegalStateException("No planned item left at cursor " + cursor);
    }
    return queue.get(cursor);
  }

  /** The item most recently appended to the materialized list, if any. */
  public Optional<LibraryItem> lastMaterialized() {
    return materialized.isEmpty()
        ? Optional.empty()
        : Optional.of(materialized.get(materialized.size() - 1));
  }

  /** Appends a stored item and advances the cursor past the entry it was built from. */
  public void recordMaterialized(LibraryItem item) {
    materialized.add(item);
    cursor++;
  }

  public void recordUpload(StoredArtifact artifact) {
    uploads.add(artifact);
  }

  public List<LibraryItem> getMaterialized() {
    return Collections.unmodifiableList(materialized);
  }

  public List<StoredArtifact> getUploads() {
    return Collections.unmodifiableList(uploads);
  }

  /** Moves the run to {@link PipelineStage#FAILED}, keeping the cause. */
  public void fail(Throwable cause) {
    this.error = cause;
    this.stage = PipelineStage.FAILED;
  }
}
