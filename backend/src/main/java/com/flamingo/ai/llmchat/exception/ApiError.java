package com.flamingo.ai.llmchat.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_ACTIVE = "SESSION_001";
  public static final String SESSION_BUSY = "SESSION_002";
  public static final String CONVERSATION_NOT_FOUND = "CONVERSATION_001";
  public static final String PROVIDER_NOT_FOUND = "PROVIDER_001";
  public static final String PROVIDER_ERROR = "PROVIDER_002";
  public static final String PROVIDER_RATE_LIMITED = "PROVIDER_003";
  public static final String INVALID_STATE = "STATE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (validation failures). */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
