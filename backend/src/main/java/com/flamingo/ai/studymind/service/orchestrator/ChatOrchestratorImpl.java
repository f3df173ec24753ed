package com.flamingo.ai.studymind.service.orchestrator;

import com.flamingo.ai.studymind.domain.entity.ChatSession;
import com.flamingo.ai.studymind.domain.entity.ChatTurn;
import com.flamingo.ai.studymind.domain.enums.Intent;
import com.flamingo.ai.studymind.domain.enums.MessageRole;
import com.flamingo.ai.studymind.service.intent.IntentClassifier;
import com.flamingo.ai.studymind.service.materialize.ContentMaterializer;
import com.flamingo.ai.studymind.service.planning.ContentPlanner;
import com.flamingo.ai.studymind.service.reference.MentionResolver;
import com.flamingo.ai.studymind.service.reply.ReplySynthesizer;
import com.flamingo.ai.studymind.service.session.ChatSessionService;
import com.flamingo.ai.studymind.service.storage.ObjectStorageService;
import com.flamingo.ai.studymind.service.storage.StoredArtifact;
import com.flamingo.ai.studymind.service.summary.SessionSummarizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Explicit state machine over {@link PipelineStage}.
 *
 * <p>The whole run shares one database transaction, so a failure at any stage rolls back every
 * library item and turn written before it. Files uploaded during the run are deleted when the
 * transaction does not commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatOrchestratorImpl implements ChatOrchestrator {

  private final ChatSessionService chatSessionService;
  private final SessionSummarizer sessionSummarizer;
  private final IntentClassifier intentClassifier;
  private final MentionResolver mentionResolver;
  private final ContentPlanner contentPlanner;
  private final ContentMaterializer contentMaterializer;
  private final ReplySynthesizer replySynthesizer;
  private final ObjectStorageService objectStorageService;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "pipeline.run", description = "Time to run a chat pipeline")
  public ChatExchange handle(Long userId, UUID sessionUid, String message) {
    Optional<ChatSession> existing = chatSessionService.findActiveOwned(userId, sessionUid);
    List<ChatTurn> priorTurns = existing.map(chatSessionService::getTurns).orElse(List.of());
    PipelineState state =
        new PipelineState(userId, sessionUid, message, priorTurns, existing.orElse(null));

    log.info(
        "Pipeline started for session {} (user={}, priorTurns={})",
        sessionUid,
        userId,
        priorTurns.size());
    try {
      state.setSummary(sessionSummarizer.summarize(priorTurns));
      while (state.getStage() != PipelineStage.DONE) {
        state.setStage(advance(state));
      }
    } catch (RuntimeException e) {
      PipelineStage failedAt = state.getStage();
      state.fail(e);
      meterRegistry
          .counter(
              "pipeline.failures",
              "stage",
              failedAt.name(),
              "error",
              e.getClass().getSimpleName())
          .increment();
      log.error(
          "Pipeline failed at {} for session {}: {}", failedAt, sessionUid, e.getMessage(), e);
      deleteUploads(state.getUploads());
      throw e;
    }

    registerRollbackCleanup(state.getUploads());
    meterRegistry.counter("pipeline.runs", "intent", state.getIntent().name()).increment();
    log.info(
        "Pipeline finished for session {}: intent={}, created={}",
        sessionUid,
        state.getIntent(),
        state.getMaterialized().size());
    return new ChatExchange(state.getSession(), state.getReply(), state.getMaterialized());
  }

  /** Runs the current stage and returns the next one. */
  PipelineStage advance(PipelineState state) {
    return switch (state.getStage()) {
      case CLASSIFYING -> {
        state.setClassification(
            intentClassifier.classify(state.getUserMessage(), state.getSummary()));
        yield afterClassification(state.getIntent());
      }
      case CONVERSING -> {
        state.setResponse(replySynthesizer.converse(state));
        yield PipelineStage.SYNTHESIZING;
      }
      case RESOLVING_REFERENCES -> {
        state.setReferences(
            mentionResolver.resolve(
                state.getUserId(),
                state.getUserMessage(),
                state.getPriorTurns(),
                state.getSummary()));
        yield state.getIntent() == Intent.CREATE
            ? PipelineStage.PLANNING
            : PipelineStage.ANALYZING;
      }
      case PLANNING -> {
        state.setQueue(
            contentPlanner.plan(
                state.getUserMessage(), state.getSummary(), state.getReferences()));
        yield PipelineStage.MATERIALIZING;
      }
      case MATERIALIZING -> {
        contentMaterializer.materializeNext(state);
        yield state.hasPendingItems() ? PipelineStage.MATERIALIZING : PipelineStage.SYNTHESIZING;
      }
      case ANALYZING -> {
        state.setResponse(replySynthesizer.analyze(state));
        yield PipelineStage.SYNTHESIZING;
      }
      case SYNTHESIZING -> {
        state.setReply(replySynthesizer.synthesize(state));
        yield PipelineStage.PERSISTING;
      }
      case PERSISTING -> {
        persist(state);
        yield PipelineStage.DONE;
      }
      case DONE, FAILED -> throw new IllegalStateException("No transition out of " + state.getStage());
    };
  }

  static PipelineStage afterClassification(Intent intent) {
    return switch (intent) {
      case CONVERSE -> PipelineStage.CONVERSING;
      case CREATE, READ -> PipelineStage.RESOLVING_REFERENCES;
      case UPDATE, DELETE -> PipelineStage.SYNTHESIZING;
    };
  }

  private void persist(PipelineState state) {
    ChatSession session =
        chatSessionService.upsertSession(
            state.getUserId(),
            state.getSessionUid(),
            state.getClassification(),
            state.getSummary(),
            state.getUserMessage());
    chatSessionService.appendTurn(session, MessageRole.USER, state.getUserMessage());
    chatSessionService.appendTurn(
        session, MessageRole.ASSISTANT, state.getReply().storedMessage());
    state.setSession(session);
  }

  private void registerRollbackCleanup(List<StoredArtifact> uploads) {
    if (uploads.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
      return;
    }
    List<StoredArtifact> pending = new ArrayList<>(uploads);
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            if (status == STATUS_ROLLED_BACK) {
              deleteUploads(pending);
            }
          }
        });
  }

  private void deleteUploads(List<StoredArtifact> uploads) {
    for (StoredArtifact artifact : uploads) {
      try {
        objectStorageService.delete(artifact.path());
        log.info("Deleted orphaned upload {}", artifact.path());
      } catch (RuntimeException e) {
        log.warn("Failed to delete orphaned upload {}: {}", artifact.path(), e.getMessage());
        meterRegistry.counter("storage.cleanup.failures").increment();
      }
    }
  }
}
