package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method sets {@code event_type} plus the fields of one event, logs a line and clears the
 * event fields again. Session context set via {@link #setSessionContext} stays in place until
 * {@link #clearSessionContext} is called.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "chunk_index",
    "chunkId",
    "sizeBytes",
    "replaced",
    "attempt",
    "maxAttempts",
    "errorType",
    "durationSeconds",
    "transcribeMs",
    "confidence",
    "leftChunk",
    "rightChunk",
    "overlapSeconds",
    "dupRemoved",
    "overlapCharsRemoved",
    "fromStatus",
    "toStatus",
    "cacheKey",
    "namespace",
    "hit",
    "removedEntries",
    "freedBytes"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk stored event. */
  public void logChunkUploaded(int chunkIndex, String chunkId, long sizeBytes, boolean replaced) {
    try {
      MDC.put("event_type", "chunk_uploaded");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chunkId", chunkId);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("replaced", String.valueOf(replaced));

      logger.info(
          "Chunk uploaded: index={}, chunkId={}, size={} bytes, replaced={}",
          chunkIndex,
          chunkId,
          sizeBytes,
          replaced);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription started event. */
  public void logTranscribeStarted(int chunkIndex, String chunkId, int attempt) {
    try {
      MDC.put("event_type", "transcribe_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chunkId", chunkId);
      MDC.put("attempt", String.valueOf(attempt));

      logger.debug("Transcribe started: chunk={}, attempt={}", chunkIndex, attempt);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription finished event. */
  public void logTranscribeFinished(
      int chunkIndex, double durationSeconds, double confidence, long transcribeMs) {
    try {
      MDC.put("event_type", "transcribe_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Transcribe finished: chunk={}, duration={}s, confidence={}, transcribe={}ms",
          chunkIndex,
          durationSeconds,
          confidence,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int chunkIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(int chunkIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Transcribe failed: chunk={}, attempts={}, error={}, message={}",
          chunkIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log overlap merge event. */
  public void logOverlapMerge(
      int leftChunk,
      int rightChunk,
      double overlapSeconds,
      boolean dupRemoved,
      int overlapCharsRemoved) {
    try {
      MDC.put("event_type", "overlap_merge");
      MDC.put("leftChunk", String.valueOf(leftChunk));
      MDC.put("rightChunk", String.valueOf(rightChunk));
      MDC.put("overlapSeconds", String.valueOf(overlapSeconds));
      MDC.put("dupRemoved", String.valueOf(dupRemoved));
      MDC.put("overlapCharsRemoved", String.valueOf(overlapCharsRemoved));

      logger.debug(
          "Overlap merge: chunks=[{},{}], overlap={}s, dupRemoved={}, charsRemoved={}",
          leftChunk,
          rightChunk,
          overlapSeconds,
          dupRemoved,
          overlapCharsRemoved);
    } finally {
      clearEventFields();
    }
  }

  /** Log session status transition. */
  public void logSessionTransition(String sessionId, String fromStatus, String toStatus) {
    try {
      MDC.put("event_type", "session_transition");
      MDC.put("fromStatus", fromStatus);
      MDC.put("toStatus", toStatus);

      logger.info("Session transition: session={}, {} -> {}", sessionId, fromStatus, toStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Log cache lookup event. */
  public void logCacheLookup(String namespace, String cacheKey, boolean hit) {
    try {
      MDC.put("event_type", "cache_lookup");
      MDC.put("namespace", namespace);
      MDC.put("cacheKey", cacheKey);
      MDC.put("hit", String.valueOf(hit));

      logger.debug("Cache lookup: namespace={}, key={}, hit={}", namespace, cacheKey, hit);
    } finally {
      clearEventFields();
    }
  }

  /** Log cache cleanup event. */
  public void logCacheCleanup(int removedEntries, long freedBytes) {
    try {
      MDC.put("event_type", "cache_cleanup");
      MDC.put("removedEntries", String.valueOf(removedEntries));
      MDC.put("freedBytes", String.valueOf(freedBytes));

      logger.info("Cache cleanup: removed={}, freed={} bytes", removedEntries, freedBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId) {
    MDC.put("sessionId", sessionId);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
  }

  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
