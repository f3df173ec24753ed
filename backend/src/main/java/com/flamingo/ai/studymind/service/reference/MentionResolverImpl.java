package com.flamingo.ai.studymind.service.reference;

import com.flamingo.ai.studymind.agent.ReferenceSelectionAgent;
import com.flamingo.ai.studymind.agent.dto.ReferenceSelection;
import com.flamingo.ai.studymind.agent.dto.ReferenceSelectionResult;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import com.flamingo.ai.studymind.domain.metadata.FlashcardMetadata;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import com.flamingo.ai.studymind.domain.metadata.NoteMetadata;
import com.flamingo.ai.studymind.domain.repository.LibraryItemRepository;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.marker.InlineMarker;
import com.flamingo.ai.studymind.service.marker.MarkerParser;
import com.flamingo.ai.studymind.service.search.DocumentSearchService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reference resolution backed by {@link ReferenceSelectionAgent} and the library store.
 *
 * <p>Candidates are ordered oldest first so that, for any dedup decision, the later candidate is
 * the more recent one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MentionResolverImpl implements MentionResolver {

  static final String MEDIA_PLACEHOLDER = "Reading %s content is not supported yet.";
  static final String EMPTY_FOLDER = "This folder has no files yet.";

  private final ReferenceSelectionAgent referenceSelectionAgent;
  private final LibraryItemRepository libraryItemRepository;
  private final DocumentSearchService documentSearchService;
  private final StudyMindConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.resolve", description = "Time to resolve references")
  @CircuitBreaker(name = "openai", fallbackMethod = "resolveFallback")
  public List<Reference> resolve(
      Long userId, String message, List<ChatTurn> priorTurns, String summary) {
    List<InlineMarker> candidates = collectCandidates(message, priorTurns);
    if (candidates.isEmpty()) {
      log.debug("No reference markers found, skipping resolution");
      return List.of();
    }

    List<ReferenceSelection> selections = select(message, summary, candidates);
    if (selections.isEmpty()) {
      log.info("Reference selection kept none of {} candidates", candidates.size());
      return List.of();
    }

    List<Reference> references = new ArrayList<>();
    for (ReferenceSelection selection : selections) {
      InlineMarker marker = findCandidate(candidates, selection.uid());
      load(userId, marker).ifPresent(item -> references.add(toReference(item, selection, marker)));
    }
    log.info(
        "Resolved {} references from {} candidates: {}",
        references.size(),
        candidates.size(),
        references.stream().map(Reference::name).collect(Collectors.toList()));
    return references;
  }

  /** Markers of prior assistant turns first, then the current message; one entry per uid. */
  List<InlineMarker> collectCandidates(String message, List<ChatTurn> priorTurns) {
    List<InlineMarker> found = new ArrayList<>();
    if (priorTurns != null) {
      for (ChatTurn turn : priorTurns) {
        if (turn.getRole() == MessageRole.ASSISTANT) {
          found.addAll(MarkerParser.parse(turn.getMessage()));
        }
      }
    }
    found.addAll(MarkerParser.parse(message));

    // Re-inserting moves a repeated uid to its latest position
    Map<String, InlineMarker> byUid = new LinkedHashMap<>();
    for (InlineMarker marker : found) {
      byUid.remove(marker.uid());
      byUid.put(marker.uid(), marker);
    }
    return new ArrayList<>(byUid.values());
  }

  private List<ReferenceSelection> select(
      String message, String summary, List<InlineMarker> candidates) {
    ReferenceSelectionResult result;
    try {
      result =
          referenceSelectionAgent.select(
              message, summary == null ? "" : summary, describeCandidates(candidates));
    } catch (RuntimeException e) {
      log.error("Reference selection call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Reference selection failed", e);
    }
    if (result == null || result.references() == null) {
      return List.of();
    }

    Map<String, ReferenceSelection> byUid = new LinkedHashMap<>();
    for (ReferenceSelection selection : result.references()) {
      InlineMarker candidate =
          selection == null ? null : findCandidate(candidates, selection.uid());
      if (candidate == null) {
        log.warn(
            "Reference selection returned a uid that was not a candidate: {}",
            selection == null ? null : selection.uid());
        continue;
      }
      byUid.put(candidate.uid(), selection);
    }
    List<ReferenceSelection> known = new ArrayList<>(byUid.values());
    known.sort(
        (a, b) -> Integer.compare(indexOf(candidates, a.uid()), indexOf(candidates, b.uid())));
    return dedupShallowByPurpose(known);
  }

  /**
   * Keeps the most recent of several shallow references that share a purpose. Selections must be
   * ordered oldest first.
   */
  static List<ReferenceSelection> dedupShallowByPurpose(List<ReferenceSelection> selections) {
    Map<String, ReferenceSelection> latestShallow = new LinkedHashMap<>();
    for (ReferenceSelection selection : selections) {
      if (!selection.needContent()) {
        latestShallow.put(normalizePurpose(selection.purpose()), selection);
      }
    }
    List<ReferenceSelection> kept = new ArrayList<>();
    for (ReferenceSelection selection : selections) {
      if (selection.needContent()
          || latestShallow.get(normalizePurpose(selection.purpose())) == selection) {
        kept.add(selection);
      }
    }
    return kept;
  }

  private Optional<LibraryItem> load(Long userId, InlineMarker marker) {
    UUID uid;
    try {
      uid = UUID.fromString(marker.uid());
    } catch (IllegalArgumentException e) {
      log.warn("Skipping reference with malformed uid '{}'", marker.uid());
      meterRegistry.counter("pipeline.references.skipped", "reason", "malformed").increment();
      return Optional.empty();
    }
    Optional<LibraryItem> item =
        libraryItemRepository.findByUidAndUserIdAndIsActiveTrue(uid, userId);
    if (item.isEmpty()) {
      log.warn("Skipping reference {} ('{}'): not found for user {}", uid, marker.name(), userId);
      meterRegistry.counter("pipeline.references.skipped", "reason", "not_found").increment();
    }
    return item;
  }

  private Reference toReference(
      LibraryItem item, ReferenceSelection selection, InlineMarker marker) {
    String content = selection.needContent() ? truncate(readContent(item, selection)) : "";
    return new Reference(
        item.getId(),
        item.getUid(),
        item.getName(),
        item.getType(),
        item.getParentId(),
        selection.needContent(),
        content,
        selection.purpose() == null ? "" : selection.purpose().trim(),
        marker.kind());
  }

  private String readContent(LibraryItem item, ReferenceSelection selection) {
    LibraryItemMetadata metadata = item.getMetadata();
    return switch (item.getType()) {
      case NOTE ->
          metadata instanceof NoteMetadata note && note.notes() != null ? note.notes() : "";
      case DOCUMENT -> {
        String query =
            selection.purpose() == null || selection.purpose().isBlank()
                ? item.getName()
                : selection.purpose();
        yield documentSearchService.search(
            item.getUid(), query, config.getReferences().getSearchTopK());
      }
      case FLASHCARD -> metadata instanceof FlashcardMetadata deck ? formatCards(deck.cards()) : "";
      case FOLDER -> listFolder(item);
      default -> String.format(MEDIA_PLACEHOLDER, item.getType().name().toLowerCase(Locale.ROOT));
    };
  }

  private String listFolder(LibraryItem folder) {
    List<LibraryItem> children =
        libraryItemRepository.findActiveChildrenExcludingType(
            folder.getId(), folder.getUserId(), LibraryItemType.FOLDER);
    if (children.isEmpty()) {
      return EMPTY_FOLDER;
    }
    return children.stream()
        .map(child -> "- " + child.getName() + " (" + child.getType() + ")")
        .collect(Collectors.joining("\n", "Folder contents:\n", ""));
  }

  private static String formatCards(List<Flashcard> cards) {
    return cards.stream()
        .map(card -> "Q: " + card.question() + "\nA: " + card.answer())
        .collect(Collectors.joining("\n\n"));
  }

  private String truncate(String content) {
    int max = config.getReferences().getMaxContentChars();
    if (content == null) {
      return "";
    }
    return content.length() > max ? content.substring(0, max) + "..." : content;
  }

  private static String describeCandidates(List<InlineMarker> candidates) {
    return candidates.stream()
        .map(
            m ->
                String.format(
                    "- uid=%s type=%s name=\"%s\" source=%s",
                    m.uid(), m.type(), m.name(), m.kind().keyword()))
        .collect(Collectors.joining("\n"));
  }

  private static InlineMarker findCandidate(List<InlineMarker> candidates, String uid) {
    if (uid == null) {
      return null;
    }
    String trimmed = uid.trim();
    return candidates.stream().filter(c -> c.uid().equals(trimmed)).findFirst().orElse(null);
  }

  private static int indexOf(List<InlineMarker> candidates, String uid) {
    return candidates.indexOf(findCandidate(candidates, uid));
  }

  private static String normalizePurpose(String purpose) {
    return purpose == null ? "" : purpose.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }

  @SuppressWarnings("unused")
  private List<Reference> resolveFallback(
      Long userId,
      String message,
      List<ChatTurn> priorTurns,
      String summary,
      CallNotPermittedException e) {
    log.warn("Reference selection circuit open: {}", e.getMessage());
    throw new LlmServiceException("Reference selection is unavailable", e);
  }
}
