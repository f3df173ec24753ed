package com.flamingo.ai.studymind.service.materialize;

import com.flamingo.ai.studymind.agent.FlashcardGenerationAgent;
import com.flamingo.ai.studymind.agent.dto.FlashcardSet;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.AudioMetadata;
import com.flamingo.ai.studymind.domain.metadata.DocumentMetadata;
import com.flamingo.ai.studymind.domain.metadata.FileMetadata;
import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import com.flamingo.ai.studymind.domain.metadata.FlashcardMetadata;
import com.flamingo.ai.studymind.domain.metadata.FolderMetadata;
import com.flamingo.ai.studymind.domain.metadata.ImageMetadata;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import com.flamingo.ai.studymind.domain.metadata.NoteMetadata;
import com.flamingo.ai.studymind.domain.repository.LibraryItemRepository;
import com.flamingo.ai.studymind.exception.ContentGenerationException;
import com.flamingo.ai.studymind.exception.ContentPlanningException;
import com.flamingo.ai.studymind.exception.LibraryItemNotFoundException;
import com.flamingo.ai.studymind.exception.UnsupportedContentException;
import com.flamingo.ai.studymind.service.orchestrator.PipelineState;
import com.flamingo.ai.studymind.service.planning.ParentRef;
import com.flamingo.ai.studymind.service.planning.PlannedContentItem;
import com.flamingo.ai.studymind.service.render.RenderingService;
import com.flamingo.ai.studymind.service.storage.StoredArtifact;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Materializes planned items one at a time, rendering files where the type needs one. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentMaterializerImpl implements ContentMaterializer {

  private static final Pattern RESOLUTION =
      Pattern.compile("^\\s*(\\d{2,5})\\s*[xX]\\s*(\\d{2,5})\\s*$");

  private final LibraryItemRepository libraryItemRepository;
  private final RenderingService renderingService;
  private final FlashcardGenerationAgent flashcardGenerationAgent;
  private final StudyMindConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "pipeline.materialize", description = "Time to materialize one item")
  public LibraryItem materializeNext(PipelineState state) {
    PlannedContentItem planned = state.currentItem();
    Long parentId = resolveParent(planned.parent(), state);
    LibraryItemMetadata metadata = prepareMetadata(planned, state);

    LibraryItem item =
        LibraryItem.builder()
            .userId(state.getUserId())
            .parentId(parentId)
            .type(planned.type())
            .name(planned.name())
            .metadata(metadata)
            .isEmbedded(planned.type().isEmbeddedOnCreate())
            .build();
    LibraryItem saved = libraryItemRepository.save(item);
    state.recordMaterialized(saved);

    meterRegistry
        .counter("pipeline.materialized.items", "type", planned.type().name())
        .increment();
    log.info(
        "Materialized {} '{}' (id={}, uid={}, parent={})",
        saved.getType(),
        saved.getName(),
        saved.getId(),
        saved.getUid(),
        saved.getParentId());
    return saved;
  }

  private Long resolveParent(ParentRef parent, PipelineState state) {
    if (parent instanceof ParentRef.PendingSibling) {
      return state
          .lastMaterialized()
          .map(LibraryItem::getId)
          .orElseThrow(
              () ->
                  new ContentPlanningException(
                      "Item refers to a previous item but nothing was created before it"));
    }
    if (parent instanceof ParentRef.Existing existing) {
      return libraryItemRepository
          .findByIdAndUserIdAndIsActiveTrue(existing.id(), state.getUserId())
          .map(LibraryItem::getId)
          .orElseThrow(() -> new LibraryItemNotFoundException("id=" + existing.id()));
    }
    return null;
  }

  private LibraryItemMetadata prepareMetadata(PlannedContentItem planned, PipelineState state) {
    LibraryItemMetadata metadata = planned.metadata();
    return switch (planned.type()) {
      case FOLDER -> {
        FolderMetadata folder =
            metadata instanceof FolderMetadata f ? f : new FolderMetadata(null, null);
        yield folder.normalized();
      }
      case NOTE -> {
        NoteMetadata note = metadata instanceof NoteMetadata n ? n : new NoteMetadata(null, null);
        yield note.notes() == null ? new NoteMetadata(note.description(), "") : note;
      }
      case FLASHCARD -> prepareDeck(planned, metadata);
      case DOCUMENT -> {
        DocumentMetadata document =
            metadata instanceof DocumentMetadata d
                ? d
                : new DocumentMetadata(null, "pdf", null, null, null);
        yield attach(
            document, renderingService.renderDocument(planned.name(), planned.prompt()), state);
      }
      case AUDIO -> {
        AudioMetadata audio =
            metadata instanceof AudioMetadata a
                ? a
                : new AudioMetadata(null, "mp3", null, null, null, null);
        yield attach(audio, renderingService.renderAudio(planned.name(), planned.prompt()), state);
      }
      case IMAGE -> prepareImage(planned, metadata, state);
      case VIDEO -> throw new UnsupportedContentException("Video creation");
    };
  }

  private FlashcardMetadata prepareDeck(PlannedContentItem planned, LibraryItemMetadata metadata) {
    FlashcardMetadata deck =
        metadata instanceof FlashcardMetadata f ? f : new FlashcardMetadata(null, List.of(), 0);
    List<Flashcard> cards = completeCards(deck.cards());
    if (cards.isEmpty()) {
      cards = completeCards(generateCards(planned.name(), deck.description()));
    }
    if (cards.isEmpty()) {
      throw new ContentGenerationException(
          LibraryItemType.FLASHCARD, planned.name(), "No usable flashcards were generated");
    }
    int maxCards = Math.min(config.getFlashcards().getMaxCards(), FlashcardMetadata.MAX_CARDS);
    if (cards.size() > maxCards) {
      log.debug("Capping deck '{}' from {} to {} cards", planned.name(), cards.size(), maxCards);
      cards = cards.subList(0, maxCards);
    }
    return deck.withCards(cards);
  }

  private List<Flashcard> generateCards(String name, String description) {
    FlashcardSet set;
    try {
      set =
          flashcardGenerationAgent.generate(
              name,
              description == null ? "" : description,
              config.getFlashcards().getMinCards(),
              config.getFlashcards().getMaxCards());
    } catch (RuntimeException e) {
      throw new ContentGenerationException(
          LibraryItemType.FLASHCARD, name, "Flashcard generation failed: " + e.getMessage(), e);
    }
    return set == null || set.cards() == null ? List.of() : set.cards();
  }

  private ImageMetadata prepareImage(
      PlannedContentItem planned, LibraryItemMetadata metadata, PipelineState state) {
    ImageMetadata image =
        metadata instanceof ImageMetadata i
            ? i
            : new ImageMetadata(null, "png", null, null, null, null);
    String resolution = normalizeResolution(image.resolution());
    String[] dimensions = resolution.split("x");
    StoredArtifact artifact =
        renderingService.renderImage(
            planned.name(),
            planned.prompt(),
            Integer.parseInt(dimensions[0]),
            Integer.parseInt(dimensions[1]));
    return attach(image.withResolution(resolution), artifact, state);
  }

  /** Returns {@code WxH}, or the configured default when the input is missing or malformed. */
  String normalizeResolution(String resolution) {
    if (resolution != null) {
      Matcher matcher = RESOLUTION.matcher(resolution);
      if (matcher.matches()) {
        int width = Integer.parseInt(matcher.group(1));
        int height = Integer.parseInt(matcher.group(2));
        if (width > 0 && height > 0) {
          return width + "x" + height;
        }
      }
    }
    log.debug("Using default resolution for '{}'", resolution);
    return config.getRendering().getDefaultResolution();
  }

  @SuppressWarnings("unchecked")
  private static <T extends FileMetadata> T attach(
      T metadata, StoredArtifact artifact, PipelineState state) {
    state.recordUpload(artifact);
    return (T) metadata.withFile(artifact.path(), artifact.url(), artifact.size());
  }

  private static List<Flashcard> completeCards(List<Flashcard> cards) {
    if (cards == null) {
      return List.of();
    }
    return cards.stream()
        .filter(card -> card != null && card.isComplete())
        .collect(Collectors.toList());
  }
}
