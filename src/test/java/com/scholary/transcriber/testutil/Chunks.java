package com.scholary.transcriber.testutil;

import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkSegment;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Chunk rows in a given state, for seeding repositories. */
public final class Chunks {

  private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

  private Chunks() {}

  public static Chunk pending(String sessionId, int index) {
    return pending(sessionId, index, 2.0);
  }

  public static Chunk pending(String sessionId, int index, double overlapSeconds) {
    String chunkId = UUID.randomUUID().toString();
    return Chunk.pending(
        sessionId,
        index,
        chunkId,
        null,
        overlapSeconds,
        "chunk.webm",
        "webm",
        "audio/webm",
        10,
        String.format("sessions/%s/chunk_%04d_%s.webm", sessionId, index, chunkId),
        AT);
  }

  public static Chunk completed(String sessionId, int index, String text, double confidence) {
    return completed(sessionId, index, text, confidence, 10.0);
  }

  public static Chunk completed(
      String sessionId, int index, String text, double confidence, double duration) {
    return pending(sessionId, index)
        .processing()
        .completed(
            text,
            List.of(new ChunkSegment(0.0, duration, text, confidence)),
            confidence,
            duration,
            "en",
            1,
            AT);
  }

  public static Chunk failed(String sessionId, int index) {
    return pending(sessionId, index).processing().failed(3, "SERVER_ERROR: boom", AT);
  }

  public static Chunk uploadFailed(String sessionId, int index) {
    return Chunk.uploadFailed(
        sessionId,
        index,
        UUID.randomUUID().toString(),
        null,
        2.0,
        "chunk.webm",
        "webm",
        "audio/webm",
        10,
        "disk full",
        AT);
  }
}
