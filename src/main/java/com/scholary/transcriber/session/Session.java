package com.scholary.transcriber.session;

import java.time.Instant;
import java.util.Objects;

/**
 * A recording session grouping all chunks of one interview.
 *
 * <p>Created implicitly by the first chunk upload. {@code totalChunksExpected} is optional and the
 * latest non-null value supplied with a chunk wins. {@code completedAt} is set once, when the
 * session becomes COMPLETED.
 */
public record Session(
    String sessionId,
    SessionStatus status,
    Integer totalChunksExpected,
    int uploadedChunks,
    double totalDurationSeconds,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    String failureReason) {

  public Session {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(status, "status");
  }

  public static Session open(String sessionId, Instant now) {
    return new Session(sessionId, SessionStatus.OPEN, null, 0, 0.0, now, now, null, null);
  }

  /** Apply the stats of a stored chunk. Moves an OPEN session to RECEIVING. */
  public Session chunkStored(
      Integer totalChunks, int uploaded, double totalDuration, Instant now) {
    SessionStatus next = status == SessionStatus.OPEN ? SessionStatus.RECEIVING : status;
    Integer total = totalChunks != null ? totalChunks : totalChunksExpected;
    return new Session(
        sessionId, next, total, uploaded, totalDuration, createdAt, now, completedAt,
        failureReason);
  }

  public Session withStats(int uploaded, double totalDuration, Instant now) {
    return new Session(
        sessionId, status, totalChunksExpected, uploaded, totalDuration, createdAt, now,
        completedAt, failureReason);
  }

  public Session complete(double totalDuration, Instant now) {
    return new Session(
        sessionId, SessionStatus.COMPLETED, totalChunksExpected, uploadedChunks, totalDuration,
        createdAt, now, now, null);
  }

  public Session fail(String reason, Instant now) {
    return new Session(
        sessionId, SessionStatus.FAILED, totalChunksExpected, uploadedChunks,
        totalDurationSeconds, createdAt, now, null, reason);
  }

  public boolean isFinalIndex(int sequenceIndex) {
    return totalChunksExpected != null && sequenceIndex == totalChunksExpected - 1;
  }
}
