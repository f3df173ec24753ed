package com.flamingo.ai.studymind.service.orchestrator;

/** States of a single chat pipeline run. */
public enum PipelineStage {
  CLASSIFYING,
  CONVERSING,
  RESOLVING_REFERENCES,
  PLANNING,
  MATERIALIZING,
  ANALYZING,
  SYNTHESIZING,
  PERSISTING,
  DONE,
  FAILED
}
