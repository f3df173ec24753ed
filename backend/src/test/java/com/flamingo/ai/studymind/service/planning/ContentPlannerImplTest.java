package com.flamingo.ai.studymind.service.planning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymind.agent.ContentEnrichmentAgent;
import com.flamingo.ai.studymind.agent.ContentPlanningAgent;
import com.flamingo.ai.studymind.agent.dto.ContentEnrichmentResult;
import com.flamingo.ai.studymind.agent.dto.ContentPlanResult;
import com.flamingo.ai.studymind.agent.dto.PlannedItemDraft;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.enums.LibraryItemType;
import com.flamingo.ai.studymind.domain.metadata.FolderMetadata;
import com.flamingo.ai.studymind.domain.metadata.ImageMetadata;
import com.flamingo.ai.studymind.domain.metadata.NoteMetadata;
import com.flamingo.ai.studymind.exception.ContentPlanningException;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.marker.MarkerKind;
import com.flamingo.ai.studymind.service.reference.Reference;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContentPlannerImplTest {

  @Mock private ContentPlanningAgent contentPlanningAgent;
  @Mock private ContentEnrichmentAgent contentEnrichmentAgent;

  private StudyMindConfig config;
  private SimpleMeterRegistry meterRegistry;
  private ContentPlannerImpl planner;

  @BeforeEach
  void setUp() {
    config = new StudyMindConfig();
    meterRegistry = new SimpleMeterRegistry();
    planner =
        new ContentPlannerImpl(contentPlanningAgent, contentEnrichmentAgent, config, meterRegistry);
  }

  @Test
  void shouldPlanFolderWithTwoNotes_whenNotesReferToPreviousItem() {
    // Given
    String message = "Create a Biology folder with two notes";
    planReturns(
        new PlannedItemDraft("Biology", "FOLDER", 0L),
        new PlannedItemDraft("Cells", "NOTE", -1L),
        new PlannedItemDraft("Genetics", "NOTE", -1L));
    when(contentEnrichmentAgent.enrichFolder(eq("Biology"), eq(message), anyString()))
        .thenReturn(folder("#4A90E2", "science"));
    when(contentEnrichmentAgent.enrichNote(eq("Cells"), eq(message), anyString()))
        .thenReturn(note("Cell basics", "Cells are units of life."));
    when(contentEnrichmentAgent.enrichNote(eq("Genetics"), eq(message), anyString()))
        .thenReturn(note("Heredity", "Genes carry traits."));

    // When
    List<PlannedContentItem> queue = planner.plan(message, "", List.of());

    // Then
    assertThat(queue)
        .extracting(PlannedContentItem::name, PlannedContentItem::type, PlannedContentItem::parent)
        .containsExactly(
            tuple("Biology", LibraryItemType.FOLDER, ParentRef.root()),
            tuple("Cells", LibraryItemType.NOTE, ParentRef.pendingSibling()),
            tuple("Genetics", LibraryItemType.NOTE, ParentRef.pendingSibling()));
    assertThat(queue.get(0).metadata()).isEqualTo(new FolderMetadata("#4A90E2", "science"));
    assertThat(queue.get(1).metadata())
        .isEqualTo(new NoteMetadata("Cell basics", "Cells are units of life."));
    assertThat(queue.get(1).prompt()).isNull();
    assertThat(meterRegistry.counter("pipeline.planned.items").count()).isEqualTo(3.0);
  }

  @Test
  void shouldAttachToReferencedFolder_whenPlanUsesItsId() {
    // Given
    Reference folder =
        new Reference(
            42L,
            UUID.randomUUID(),
            "Biology",
            LibraryItemType.FOLDER,
            null,
            false,
            "",
            "parent folder",
            MarkerKind.MENTION);
    planReturns(new PlannedItemDraft("Photosynthesis", "NOTE", 42L));
    when(contentEnrichmentAgent.enrichNote(eq("Photosynthesis"), anyString(), anyString()))
        .thenReturn(note("d", "Light to sugar."));

    // When
    List<PlannedContentItem> queue = planner.plan("Add a note", "", List.of(folder));

    // Then
    assertThat(queue.get(0).parent()).isEqualTo(ParentRef.existing(42L));
    verify(contentPlanningAgent)
        .plan(eq("Add a note"), eq(""), contains("id=42 parentId=0 type=FOLDER name=\"Biology\""));
  }

  @Test
  void shouldPassSummaryAndDeepContent_asEnrichmentContext() {
    // Given
    Reference source =
        new Reference(
            9L,
            UUID.randomUUID(),
            "Lecture",
            LibraryItemType.NOTE,
            3L,
            true,
            "Mitochondria make ATP.",
            "source",
            MarkerKind.MENTION);
    planReturns(new PlannedItemDraft("Quiz", "FLASHCARD", 3L));
    when(contentEnrichmentAgent.enrichFlashcard(
            eq("Quiz"), anyString(), contains("Mitochondria make ATP.")))
        .thenReturn(
            new ContentEnrichmentResult("Quiz deck", null, null, null, null, null, null, null));

    // When
    List<PlannedContentItem> queue =
        planner.plan("Make flashcards", "User studies biology", List.of(source));

    // Then
    assertThat(queue.get(0).parent()).isEqualTo(ParentRef.existing(3L));
    verify(contentEnrichmentAgent)
        .enrichFlashcard(eq("Quiz"), eq("Make flashcards"), contains("User studies biology"));
  }

  @Test
  void shouldFallBackToRoot_whenParentIdIsUnknown() {
    // When
    ParentRef parent = planner.toParentRef(999L, 0, Set.of(42L));

    // Then
    assertThat(parent).isEqualTo(ParentRef.root());
    assertThat(meterRegistry.counter("pipeline.plan.parent.fallback").count()).isEqualTo(1.0);
  }

  @Test
  void shouldTreatNullAndZero_asRoot() {
    assertThat(planner.toParentRef(null, 0, Set.of())).isEqualTo(ParentRef.root());
    assertThat(planner.toParentRef(0L, 3, Set.of())).isEqualTo(ParentRef.root());
  }

  @Test
  void shouldThrow_whenFirstItemRefersToPreviousItem() {
    assertThatThrownBy(() -> planner.toParentRef(-1L, 0, Set.of()))
        .isInstanceOf(ContentPlanningException.class);
  }

  @Test
  void shouldThrow_whenPlanIsEmpty() {
    // Given
    when(contentPlanningAgent.plan(anyString(), anyString(), anyString()))
        .thenReturn(new ContentPlanResult(List.of()));

    // When / Then
    assertThatThrownBy(() -> planner.plan("Make something", "", List.of()))
        .isInstanceOf(ContentPlanningException.class);
    verifyNoInteractions(contentEnrichmentAgent);
  }

  @Test
  void shouldThrow_whenPlanExceedsItemLimit() {
    // Given
    config.getPlanning().setMaxItems(2);
    planReturns(
        new PlannedItemDraft("A", "NOTE", 0L),
        new PlannedItemDraft("B", "NOTE", 0L),
        new PlannedItemDraft("C", "NOTE", 0L));

    // When / Then
    assertThatThrownBy(() -> planner.plan("Make three notes", "", List.of()))
        .isInstanceOf(ContentPlanningException.class)
        .hasMessageContaining("3 items");
    verifyNoInteractions(contentEnrichmentAgent);
  }

  @Test
  void shouldThrow_whenPlanHasUnknownType() {
    // Given
    planReturns(new PlannedItemDraft("Slides", "PRESENTATION", 0L));

    // When / Then
    assertThatThrownBy(() -> planner.plan("Make slides", "", List.of()))
        .isInstanceOf(ContentPlanningException.class)
        .hasMessageContaining("PRESENTATION");
  }

  @Test
  void shouldThrow_whenRenderedItemHasNoPrompt() {
    // Given
    planReturns(new PlannedItemDraft("Cell diagram", "IMAGE", 0L));
    when(contentEnrichmentAgent.enrichImage(eq("Cell diagram"), anyString(), anyString()))
        .thenReturn(
            new ContentEnrichmentResult("A diagram", null, null, null, null, null, "512x512", " "));

    // When / Then
    assertThatThrownBy(() -> planner.plan("Draw a cell", "", List.of()))
        .isInstanceOf(ContentPlanningException.class)
        .hasMessageContaining("prompt");
  }

  @Test
  void shouldKeepPromptAndResolution_forImage() {
    // Given
    planReturns(new PlannedItemDraft("Cell diagram", "image", null));
    when(contentEnrichmentAgent.enrichImage(eq("Cell diagram"), anyString(), anyString()))
        .thenReturn(
            new ContentEnrichmentResult(
                "A diagram", null, null, null, null, null, "512x512", "Labelled animal cell"));

    // When
    List<PlannedContentItem> queue = planner.plan("Draw a cell", "", List.of());

    // Then
    assertThat(queue.get(0).prompt()).isEqualTo("Labelled animal cell");
    assertThat(queue.get(0).metadata())
        .isEqualTo(new ImageMetadata("A diagram", "png", null, null, null, "512x512"));
  }

  @Test
  void shouldNormalizeFolderPresentation_whenModelReturnsInvalidValues() {
    // Given
    planReturns(new PlannedItemDraft("Misc", "FOLDER", 0L));
    when(contentEnrichmentAgent.enrichFolder(eq("Misc"), anyString(), anyString()))
        .thenReturn(folder("blue", "rocket"));

    // When
    List<PlannedContentItem> queue = planner.plan("Make a folder", "", List.of());

    // Then
    assertThat(queue.get(0).metadata())
        .isEqualTo(new FolderMetadata(FolderMetadata.DEFAULT_COLOR, FolderMetadata.DEFAULT_ICON));
  }

  @Test
  void shouldWrapProviderFailure() {
    // Given
    when(contentPlanningAgent.plan(anyString(), anyString(), anyString()))
        .thenThrow(new RuntimeException("timeout"));

    // When / Then
    assertThatThrownBy(() -> planner.plan("Make a note", "", List.of()))
        .isInstanceOf(LlmServiceException.class);
  }

  private void planReturns(PlannedItemDraft... drafts) {
    when(contentPlanningAgent.plan(anyString(), anyString(), anyString()))
        .thenReturn(new ContentPlanResult(List.of(drafts)));
  }

  private static ContentEnrichmentResult folder(String color, String icon) {
    return new ContentEnrichmentResult(null, null, color, icon, null, null, null, null);
  }

  private static ContentEnrichmentResult note(String description, String notes) {
    return new ContentEnrichmentResult(description, notes, null, null, null, null, null, null);
  }
}
