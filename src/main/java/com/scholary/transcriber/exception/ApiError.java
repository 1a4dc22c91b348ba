package com.scholary.transcriber.exception;

import java.time.Instant;

/**
 * Error body returned by every failing endpoint.
 *
 * @param errorId unique id for correlating the response with server logs
 * @param code stable machine-readable error code
 * @param message human-readable description
 * @param path request path
 * @param timestamp when the error occurred
 */
public record ApiError(
    String errorId, String code, String message, String path, Instant timestamp) {

  public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String CONFLICT = "CONFLICT";
  public static final String AGGREGATION_UNAVAILABLE = "AGGREGATION_UNAVAILABLE";
  public static final String UPSTREAM_ERROR = "UPSTREAM_ERROR";
  public static final String STORAGE_ERROR = "STORAGE_ERROR";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
