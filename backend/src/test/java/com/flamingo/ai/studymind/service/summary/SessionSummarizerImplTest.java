package com.flamingo.ai.studymind.service.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studymind.agent.SessionSummaryAgent;
import com.flamingo.ai.studymind.config.StudyMindConfig;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.exception.LlmServiceException;
import com.flamingo.ai.studymind.service.marker.MarkerKind;
import com.flamingo.ai.studymind.service.marker.MarkerParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionSummarizerImplTest {

  private static final String FOLDER_MARKER =
      MarkerParser.format(
          MarkerKind.CREATED, "11111111-1111-1111-1111-111111111111", "Biology", "FOLDER");
  private static final String NOTE_MARKER =
      MarkerParser.format(
          MarkerKind.CREATED, "22222222-2222-2222-2222-222222222222", "Cells", "NOTE");

  @Mock private SessionSummaryAgent sessionSummaryAgent;

  private StudyMindConfig config;
  private SessionSummarizerImpl summarizer;

  @BeforeEach
  void setUp() {
    config = new StudyMindConfig();
    summarizer = new SessionSummarizerImpl(sessionSummaryAgent, config, new SimpleMeterRegistry());
  }

  @Test
  void shouldReturnEmptySummary_withoutModelCall_whenHistoryEmpty() {
    // When
    String summary = summarizer.summarize(List.of());

    // Then
    assertThat(summary).isEmpty();
    verifyNoInteractions(sessionSummaryAgent);
  }

  @Test
  void shouldKeepMarkersVerbatim_whenModelCopiesThem() {
    // Given
    List<ChatTurn> turns =
        List.of(
            turn(MessageRole.USER, "Create a Biology folder with a Cells note"),
            turn(MessageRole.ASSISTANT, "Done!\n\n" + FOLDER_MARKER + "\n" + NOTE_MARKER));
    when(sessionSummaryAgent.summarize(anyString(), anyString()))
        .thenReturn("Student organizes biology: " + FOLDER_MARKER + " and " + NOTE_MARKER);

    // When
    String summary = summarizer.summarize(turns);

    // Then
    assertThat(summary).contains(FOLDER_MARKER).contains(NOTE_MARKER);
    assertThat(summary).doesNotContain("Referenced items:");
  }

  @Test
  void shouldAppendMissingMarkers_whenModelParaphrasesThem() {
    // Given
    List<ChatTurn> turns =
        List.of(turn(MessageRole.ASSISTANT, "Here you go " + FOLDER_MARKER + " " + NOTE_MARKER));
    when(sessionSummaryAgent.summarize(anyString(), anyString()))
        .thenReturn("The assistant created a Biology folder and a note about cells.");

    // When
    String summary = summarizer.summarize(turns);

    // Then
    assertThat(summary).contains(FOLDER_MARKER).contains(NOTE_MARKER);
    assertThat(summary).startsWith("The assistant created a Biology folder");
  }

  @Test
  void shouldRemoveInventedMarkers_whenNotInHistory() {
    // Given
    String invented =
        MarkerParser.format(
            MarkerKind.CREATED, "99999999-9999-9999-9999-999999999999", "Physics", "FOLDER");
    List<ChatTurn> turns = List.of(turn(MessageRole.ASSISTANT, "Created " + FOLDER_MARKER));
    when(sessionSummaryAgent.summarize(anyString(), anyString()))
        .thenReturn("Made " + FOLDER_MARKER + " and " + invented);

    // When
    String summary = summarizer.summarize(turns);

    // Then
    assertThat(summary).contains(FOLDER_MARKER).doesNotContain(invented);
    assertThat(MarkerParser.parse(summary)).hasSize(1);
  }

  @Test
  void shouldOnlySendTrailingWindow_toModel() {
    // Given
    config.getSummary().setWindowSize(2);
    List<ChatTurn> turns = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      turns.add(turn(i % 2 == 1 ? MessageRole.USER : MessageRole.ASSISTANT, "message " + i));
    }
    when(sessionSummaryAgent.summarize(anyString(), anyString())).thenReturn("digest");
    ArgumentCaptor<String> conversation = ArgumentCaptor.forClass(String.class);

    // When
    summarizer.summarize(turns);

    // Then
    verify(sessionSummaryAgent).summarize(conversation.capture(), anyString());
    assertThat(conversation.getValue())
        .isEqualTo("ASSISTANT: message 4\nUSER: message 5")
        .doesNotContain("message 3");
  }

  @Test
  void shouldPassMarkerLiterals_asTags() {
    // Given
    List<ChatTurn> turns = List.of(turn(MessageRole.ASSISTANT, "Created " + FOLDER_MARKER));
    when(sessionSummaryAgent.summarize(anyString(), anyString())).thenReturn(FOLDER_MARKER);
    ArgumentCaptor<String> tags = ArgumentCaptor.forClass(String.class);

    // When
    summarizer.summarize(turns);

    // Then
    verify(sessionSummaryAgent).summarize(anyString(), tags.capture());
    assertThat(tags.getValue()).isEqualTo(FOLDER_MARKER);
  }

  @Test
  void shouldWrapProviderFailure_inLlmServiceException() {
    // Given
    when(sessionSummaryAgent.summarize(anyString(), anyString()))
        .thenThrow(new IllegalStateException("timeout"));

    // When / Then
    assertThatThrownBy(() -> summarizer.summarize(List.of(turn(MessageRole.USER, "hi"))))
        .isInstanceOf(LlmServiceException.class);
  }

  private static ChatTurn turn(MessageRole role, String message) {
    return ChatTurn.builder().role(role).message(message).build();
  }
}
