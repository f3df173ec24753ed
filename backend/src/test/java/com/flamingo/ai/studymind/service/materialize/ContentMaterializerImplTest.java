package com.flamingo.ai.studymind.service.materialize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymind.agent.FlashcardGenerationAgent;
import com.flamingo.ai.studymind.agent.dto.FlashcardSet;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.LibraryItem;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.DocumentMetadata;
import com.flamingo.ai.studymind.domain.metadata.Flashcard;
import com.flamingo.ai.studymind.domain.metadata.FlashcardMetadata;
import com.flamingo.ai.studymind.domain.metadata.FolderMetadata;
import com.flamingo.ai.studymind.domain.metadata.ImageMetadata;
import com.flamingo.ai.studymind.domain.metadata.NoteMetadata;
import com.flamingo.ai.studymind.domain.metadata.VideoMetadata;
import com.flamingo.ai.studymind.domain.repository.LibraryItemRepository;
import com.flamingo.ai.studymind.exception.ContentGenerationException;
import com.flamingo.ai.studymind.exception.LibraryItemNotFoundException;
import com.flamingo.ai.studymind.exception.UnsupportedContentException;
import com.flamingo.ai.studymind.service.orchestrator.PipelineState;
import com.flamingo.ai.studymind.service.planning.ParentRef;
import com.flamingo.ai.studymind.service.planning.PlannedContentItem;
import com.flamingo.ai.studymind.service.render.RenderingService;
import com.flamingo.ai.studymind.service.storage.StoredArtifact;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContentMaterializerImplTest {

  private static final Long USER_ID = 7L;

  @Mock private LibraryItemRepository libraryItemRepository;
  @Mock private RenderingService renderingService;
  @Mock private FlashcardGenerationAgent flashcardGenerationAgent;

  private final AtomicLong ids = new AtomicLong(100);
  private StudyMindConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ContentMaterializerImpl materializer;

  @BeforeEach
  void setUp() {
    config = new StudyMindConfig();
    meterRegistry = new SimpleMeterRegistry();
    materializer =
        new ContentMaterializerImpl(
            libraryItemRepository,
            renderingService,
            flashcardGenerationAgent,
            config,
            meterRegistry);
    when(libraryItemRepository.save(any(LibraryItem.class)))
        .thenAnswer(
            invocation -> {
              LibraryItem item = invocation.getArgument(0);
              item.setId(ids.incrementAndGet());
              return item;
            });
  }

  @Test
  void shouldAttachNotesToFolderCreatedInSameRun() {
    // Given
    PipelineState state =
        stateWith(
            new PlannedContentItem(
                "Biology",
                LibraryItemType.FOLDER,
                ParentRef.root(),
                new FolderMetadata("#4A90E2", "science"),
                null),
            note("Cells", ParentRef.pendingSibling()),
            note("Genetics", ParentRef.pendingSibling()));

    // When
    LibraryItem folder = materializer.materializeNext(state);
    LibraryItem cells = materializer.materializeNext(state);
    LibraryItem genetics = materializer.materializeNext(state);

    // Then
    assertThat(folder.getParentId()).isNull();
    assertThat(cells.getParentId()).isEqualTo(folder.getId());
    assertThat(genetics.getParentId()).isEqualTo(cells.getId());
    assertThat(state.getMaterialized()).containsExactly(folder, cells, genetics);
    assertThat(state.hasPendingItems()).isFalse();
    assertThat(
            meterRegistry.counter("pipeline.materialized.items", "type", "NOTE").count())
        .isEqualTo(2.0);
  }

  @Test
  void shouldVerifyExistingParent_againstStore() {
    // Given
    LibraryItem parent = LibraryItem.builder().id(42L).userId(USER_ID).build();
    when(libraryItemRepository.findByIdAndUserIdAndIsActiveTrue(42L, USER_ID))
        .thenReturn(Optional.of(parent));
    PipelineState state = stateWith(note("Photosynthesis", ParentRef.existing(42L)));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    assertThat(item.getParentId()).isEqualTo(42L);
    assertThat(item.getUserId()).isEqualTo(USER_ID);
    assertThat(item.getIsEmbedded()).isTrue();
  }

  @Test
  void shouldThrow_whenExistingParentIsGone() {
    // Given
    when(libraryItemRepository.findByIdAndUserIdAndIsActiveTrue(42L, USER_ID))
        .thenReturn(Optional.empty());
    PipelineState state = stateWith(note("Orphan", ParentRef.existing(42L)));

    // When / Then
    assertThatThrownBy(() -> materializer.materializeNext(state))
        .isInstanceOf(LibraryItemNotFoundException.class);
    assertThat(state.getMaterialized()).isEmpty();
  }

  @Test
  void shouldDefaultEmptyNotesToEmptyString() {
    // Given
    PipelineState state =
        stateWith(
            new PlannedContentItem(
                "Blank",
                LibraryItemType.NOTE,
                ParentRef.root(),
                new NoteMetadata("d", null),
                null));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    assertThat(item.getMetadata()).isEqualTo(new NoteMetadata("d", ""));
  }

  @Test
  void shouldRenderAndUploadDocument() {
    // Given
    StoredArtifact artifact =
        new StoredArtifact(
            "2026-10-19/genetics_1.pdf",
            "http://localhost/files/2026-10-19/genetics_1.pdf",
            2048L,
            "application/pdf");
    when(renderingService.renderDocument("Genetics", "# Genetics")).thenReturn(artifact);
    PipelineState state =
        stateWith(
            new PlannedContentItem(
                "Genetics",
                LibraryItemType.DOCUMENT,
                ParentRef.root(),
                new DocumentMetadata("Overview", "pdf", null, null, null),
                "# Genetics"));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    assertThat(item.getMetadata())
        .isEqualTo(
            new DocumentMetadata(
                "Overview", "pdf", artifact.path(), artifact.url(), artifact.size()));
    assertThat(item.getIsEmbedded()).isFalse();
    assertThat(state.getUploads()).containsExactly(artifact);
  }

  @Test
  void shouldUseDefaultResolution_whenPlannedResolutionIsMalformed() {
    // Given
    StoredArtifact artifact = new StoredArtifact("p.png", "u", 10L, "image/png");
    when(renderingService.renderImage("Cell", "An animal cell", 1024, 1024)).thenReturn(artifact);
    PipelineState state =
        stateWith(
            new PlannedContentItem(
                "Cell",
                LibraryItemType.IMAGE,
                ParentRef.root(),
                new ImageMetadata("d", "png", null, null, null, "large"),
                "An animal cell"));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    assertThat(((ImageMetadata) item.getMetadata()).resolution()).isEqualTo("1024x1024");
    assertThat(((ImageMetadata) item.getMetadata()).filePath()).isEqualTo("p.png");
  }

  @Test
  void shouldNormalizeResolutionText() {
    assertThat(materializer.normalizeResolution(" 512 X 768 ")).isEqualTo("512x768");
    assertThat(materializer.normalizeResolution(null)).isEqualTo("1024x1024");
    assertThat(materializer.normalizeResolution("0x0")).isEqualTo("1024x1024");
  }

  @Test
  void shouldRejectVideo() {
    // Given
    PipelineState state =
        stateWith(
            new PlannedContentItem(
                "Lecture",
                LibraryItemType.VIDEO,
                ParentRef.root(),
                new VideoMetadata("d", "mp4", null, null, null, 60),
                "A lecture"));

    // When / Then
    assertThatThrownBy(() -> materializer.materializeNext(state))
        .isInstanceOf(UnsupportedContentException.class);
    verifyNoInteractions(renderingService);
    verify(libraryItemRepository, never()).save(any());
  }

  @Test
  void shouldGenerateCards_whenPlanLeftDeckEmpty() {
    // Given
    when(flashcardGenerationAgent.generate(anyString(), anyString(), anyInt(), anyInt()))
        .thenReturn(new FlashcardSet(cards(6)));
    PipelineState state = stateWith(deck(List.of()));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    FlashcardMetadata metadata = (FlashcardMetadata) item.getMetadata();
    assertThat(metadata.cards()).hasSize(6);
    assertThat(metadata.cardCount()).isEqualTo(6);
    verify(flashcardGenerationAgent).generate("Cell Deck", "Cell biology", 5, 10);
  }

  @Test
  void shouldCapDeckAtTenCards() {
    // Given
    PipelineState state = stateWith(deck(cards(14)));

    // When
    LibraryItem item = materializer.materializeNext(state);

    // Then
    FlashcardMetadata metadata = (FlashcardMetadata) item.getMetadata();
    assertThat(metadata.cards()).hasSize(10);
    assertThat(metadata.cardCount()).isEqualTo(10);
    verifyNoInteractions(flashcardGenerationAgent);
  }

  @Test
  void shouldThrow_whenNoUsableCardsCanBeProduced() {
    // Given
    when(flashcardGenerationAgent.generate(anyString(), anyString(), anyInt(), anyInt()))
        .thenReturn(new FlashcardSet(List.of(new Flashcard("Question only", " "))));
    PipelineState state = stateWith(deck(List.of()));

    // When / Then
    assertThatThrownBy(() -> materializer.materializeNext(state))
        .isInstanceOf(ContentGenerationException.class);
  }

  private static PipelineState stateWith(PlannedContentItem... items) {
    PipelineState state = new PipelineState(USER_ID, UUID.randomUUID(), "msg", List.of(), null);
    state.setQueue(List.of(items));
    return state;
  }

  private static PlannedContentItem note(String name, ParentRef parent) {
    return new PlannedContentItem(
        name, LibraryItemType.NOTE, parent, new NoteMetadata("About " + name, "Body"), null);
  }

  private static PlannedContentItem deck(List<Flashcard> cards) {
    return new PlannedContentItem(
        "Cell Deck",
        LibraryItemType.FLASHCARD,
        ParentRef.root(),
        new FlashcardMetadata("Cell biology", cards, cards.size()),
        null);
  }

  private static List<Flashcard> cards(int count) {
    return IntStream.rangeClosed(1, count)
        .mapToObj(i -> new Flashcard("Question " + i, "Answer " + i))
        .collect(Collectors.toList());
  }
}
