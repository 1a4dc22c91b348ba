package com.scholary.transcriber.events;

import java.time.Instant;

public record ChunkUploadedEvent(
    String sessionId,
    String chunkId,
    int sequenceIndex,
    String questionId,
    long sizeBytes,
    boolean finalChunk,
    Instant occurredAt)
    implements SessionEvent {

  @Override
  public String type() {
    return "chunk-uploaded";
  }
}
