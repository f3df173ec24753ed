package com.flamingo.ai.studymind.service.planning;

import com.flamingo.ai.studymind.agent.ContentEnrichmentAgent;
import com.flamingo.ai.studymind.agent.ContentPlanningAgent;
import com.flamingo.ai.studymind.agent.dto.ContentEnrichmentResult;
import com.flamingo.ai.studymind.agent.dto.ContentPlanResult;
import com.flamingo.ai.studymind.agent.dto.PlannedItemDraft;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.AudioMetadata;
import com.flamingo.ai.studymind.domain.metadata.DocumentMetadata;
import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import com.flamingo.ai.studymind.domain.metadata.FlashcardMetadata;
import com.flamingo.ai.studymind.domain.metadata.FolderMetadata;
import com.flamingo.ai.studymind.domain.metadata.ImageMetadata;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import com.flamingo.ai.studymind.domain.metadata.NoteMetadata;
import com.flamingo.ai.studymind.domain.metadata.VideoMetadata;
import com.flamingo.ai.studymind.exception.ContentPlanningException;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.reference.Reference;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Two-step planning: a structural plan from {@link ContentPlanningAgent}, then one {@link
 * ContentEnrichmentAgent} call per item.
 *
 * <p>Parent ids in the structural plan follow the prompt contract ({@code 0}/null root, {@code -1}
 * previous item, positive existing id) and are converted to {@link ParentRef} before anything else
 * sees them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentPlannerImpl implements ContentPlanner {

  static final long ROOT_SENTINEL = 0L;
  static final long PREVIOUS_ITEM_SENTINEL = -1L;

  private final ContentPlanningAgent contentPlanningAgent;
  private final ContentEnrichmentAgent contentEnrichmentAgent;
  private final StudyMindConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.plan", description = "Time to plan content")
  @CircuitBreaker(name = "openai", fallbackMethod = "planFallback")
  public List<PlannedContentItem> plan(
      String message, String summary, List<Reference> references) {
    String safeSummary = summary == null ? "" : summary;
    List<PlannedItemDraft> drafts = requestPlan(message, safeSummary, references);

    int maxItems = config.getPlanning().getMaxItems();
    if (drafts.size() > maxItems) {
      throw new ContentPlanningException(
          "Plan has " + drafts.size() + " items, more than the limit of " + maxItems);
    }

    Set<Long> knownIds = knownIds(references);
    String context = buildContext(safeSummary, references);
    List<PlannedContentItem> queue = new ArrayList<>();
    for (int i = 0; i < drafts.size(); i++) {
      PlannedItemDraft draft = drafts.get(i);
      LibraryItemType type = LibraryItemType.fromLabel(draft.type());
      if (type == null) {
        throw new ContentPlanningException("Unknown item type in plan: " + draft.type());
      }
      if (draft.name() == null || draft.name().isBlank()) {
        throw new ContentPlanningException("Planned " + type + " has no name");
      }
      ParentRef parent = toParentRef(draft.parentId(), i, knownIds);
      queue.add(enrich(draft.name().trim(), type, parent, message, context));
    }

    meterRegistry.counter("pipeline.planned.items").increment(queue.size());
    log.info(
        "Planned {} items: {}",
        queue.size(),
        queue.stream()
            .map(item -> item.type() + " '" + item.name() + "' -> " + item.parent())
            .collect(Collectors.toList()));
    return queue;
  }

  private List<PlannedItemDraft> requestPlan(
      String message, String summary, List<Reference> references) {
    ContentPlanResult result;
    try {
      result = contentPlanningAgent.plan(message, summary, describeReferences(references));
    } catch (RuntimeException e) {
      log.error("Content planning call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Content planning failed", e);
    }
    if (result == null || result.items() == null || result.items().isEmpty()) {
      throw new ContentPlanningException("Planner returned an empty queue");
    }
    return result.items();
  }

  /**
   * Converts a planner parent id. Positive ids are only trusted when they belong to a resolved
   * reference or to its parent.
   */
  ParentRef toParentRef(Long parentId, int position, Set<Long> knownIds) {
    if (parentId == null || parentId == ROOT_SENTINEL) {
      return ParentRef.root();
    }
    if (parentId == PREVIOUS_ITEM_SENTINEL) {
      if (position == 0) {
        throw new ContentPlanningException("First planned item cannot refer to a previous item");
      }
      return ParentRef.pendingSibling();
    }
    if (parentId > 0 && knownIds.contains(parentId)) {
      return ParentRef.existing(parentId);
    }
    log.warn("Planner used unknown parent id {}, placing item at the root", parentId);
    meterRegistry.counter("pipeline.plan.parent.fallback").increment();
    return ParentRef.root();
  }

  private PlannedContentItem enrich(
      String name, LibraryItemType type, ParentRef parent, String request, String context) {
    ContentEnrichmentResult result;
    try {
      result = callEnrichment(name, type, request, context);
    } catch (RuntimeException e) {
      log.error("Enrichment of {} '{}' failed: {}", type, name, e.getMessage(), e);
      throw new LlmServiceException(
          "Content enrichment failed for " + type + " '" + name + "'", e);
    }
    if (result == null) {
      throw new ContentPlanningException("Enrichment returned nothing for " + type + " " + name);
    }

    String prompt = type.isRendered() ? result.prompt() : null;
    if (type.isRendered() && (prompt == null || prompt.isBlank())) {
      throw new ContentPlanningException(type + " '" + name + "' has no generation prompt");
    }
    return new PlannedContentItem(name, type, parent, toMetadata(type, result), prompt);
  }

  private ContentEnrichmentResult callEnrichment(
      String name, LibraryItemType type, String request, String context) {
    return switch (type) {
      case FOLDER -> contentEnrichmentAgent.enrichFolder(name, request, context);
      case NOTE -> contentEnrichmentAgent.enrichNote(name, request, context);
      case FLASHCARD -> contentEnrichmentAgent.enrichFlashcard(name, request, context);
      case DOCUMENT -> contentEnrichmentAgent.enrichDocument(name, request, context);
      case AUDIO -> contentEnrichmentAgent.enrichAudio(name, request, context);
      case VIDEO -> contentEnrichmentAgent.enrichVideo(name, request, context);
      case IMAGE -> contentEnrichmentAgent.enrichImage(name, request, context);
    };
  }

  private static LibraryItemMetadata toMetadata(
      LibraryItemType type, ContentEnrichmentResult result) {
    return switch (type) {
      case FOLDER -> new FolderMetadata(result.color(), result.icon()).normalized();
      case NOTE -> new NoteMetadata(result.description(), result.notes());
      case FLASHCARD -> {
        List<Flashcard> cards = result.cards() == null ? List.of() : result.cards();
        yield new FlashcardMetadata(result.description(), cards, cards.size());
      }
      case DOCUMENT -> new DocumentMetadata(result.description(), "pdf", null, null, null);
      case AUDIO ->
          new AudioMetadata(result.description(), "mp3", null, null, null, result.duration());
      case VIDEO ->
          new VideoMetadata(result.description(), "mp4", null, null, null, result.duration());
      case IMAGE ->
          new ImageMetadata(result.description(), "png", null, null, null, result.resolution());
    };
  }

  private static Set<Long> knownIds(List<Reference> references) {
    Set<Long> ids = new HashSet<>();
    for (Reference reference : references) {
      if (reference.itemId() != null) {
        ids.add(reference.itemId());
      }
      if (reference.parentId() != null) {
        ids.add(reference.parentId());
      }
    }
    return ids;
  }

  private static String describeReferences(List<Reference> references) {
    if (references.isEmpty()) {
      return "(none)";
    }
    return references.stream()
        .map(
            r ->
                String.format(
                    "- id=%d parentId=%s type=%s name=\"%s\" purpose=\"%s\"",
                    r.itemId(),
                    r.parentId() == null ? "0" : r.parentId().toString(),
                    r.type(),
                    r.name(),
                    r.purpose()))
        .collect(Collectors.joining("\n"));
  }

  private static String buildContext(String summary, List<Reference> references) {
    StringBuilder context = new StringBuilder();
    if (!summary.isBlank()) {
      context.append("Conversation summary:\n").append(summary).append("\n\n");
    }
    for (Reference reference : references) {
      if (reference.needContent() && !reference.content().isBlank()) {
        context
            .append("Source '")
            .append(reference.name())
            .append("' (")
            .append(reference.type())
            .append("):\n")
            .append(reference.content())
            .append("\n\n");
      }
    }
    return context.length() == 0 ? "(none)" : context.toString().trim();
  }

  @SuppressWarnings("unused")
  private List<PlannedContentItem> planFallback(
      String message,
      String summary,
      List<Reference> references,
      CallNotPermittedException e) {
    log.warn("Content planning circuit open: {}", e.getMessage());
    throw new LlmServiceException("Content planning is unavailable", e);
  }
}
