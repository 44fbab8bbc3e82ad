package com.flamingo.ai.nexuschat.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String ITEM_NOT_FOUND = "ITEM_001";
  public static final String UNSUPPORTED_FILE = "UPLOAD_001";
  public static final String FILE_TOO_LARGE = "UPLOAD_002";
  public static final String STORE_UNAVAILABLE = "STORE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
