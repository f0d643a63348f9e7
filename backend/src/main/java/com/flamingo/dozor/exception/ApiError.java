package com.flamingo.dozor.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String PLOT_FORMAT_ERROR = "PLOT_001";
  public static final String EXECUTION_FAILED = "EXEC_001";
  public static final String EXTERNAL_SERVICE_ERROR = "UPSTREAM_001";
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
