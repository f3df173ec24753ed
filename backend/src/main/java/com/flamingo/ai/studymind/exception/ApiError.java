package com.flamingo.ai.studymind.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String LIBRARY_ITEM_NOT_FOUND = "LIBRARY_001";
  public static final String INTENT_UNCLEAR = "INTENT_001";
  public static final String PLANNING_FAILED = "PLANNING_001";
  public static final String CONTENT_UNSUPPORTED = "CONTENT_001";
  public static final String CONTENT_GENERATION_FAILED = "CONTENT_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
