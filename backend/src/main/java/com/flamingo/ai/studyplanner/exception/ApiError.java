package com.flamingo.ai.studyplanner.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String UNSUPPORTED_FILE = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_002";
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_003";
  public static final String NO_TOPICS = "TOPIC_001";
  public static final String TOO_MANY_TOPICS = "TOPIC_002";
  public static final String INVALID_DATE = "SCHEDULE_001";
  public static final String NO_SCHEDULE = "SCHEDULE_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, when they help the caller correct the request. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
