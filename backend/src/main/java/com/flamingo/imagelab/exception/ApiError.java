package com.flamingo.imagelab.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String INVALID_PARAMETER = "OPERATION_001";
  public static final String UNKNOWN_OPERATION = "OPERATION_002";
  public static final String IMAGE_NOT_FOUND = "IMAGE_001";
  public static final String IMAGE_ACCESS_DENIED = "IMAGE_002";
  public static final String UNSUPPORTED_IMAGE = "IMAGE_003";
  public static final String HISTORY_NOT_FOUND = "HISTORY_001";
  public static final String CORRUPT_CHAIN = "CHAIN_001";
  public static final String PERSISTENCE_FAILURE = "STORAGE_001";
  public static final String PROCESSING_TIMEOUT = "PROCESSING_001";
  public static final String PROCESSING_REJECTED = "PROCESSING_002";
  public static final String UNAUTHORIZED = "AUTH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  @JsonProperty("error_id")
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Offending parameter or operation, when there is one. */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
