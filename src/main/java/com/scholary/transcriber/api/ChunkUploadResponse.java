package com.scholary.transcriber.api;

import com.scholary.transcriber.chunk.ChunkRef;
import com.scholary.transcriber.chunk.UploadStatus;

/** Response to a chunk upload. */
public record ChunkUploadResponse(
    String chunkId,
    String sessionId,
    int sequenceIndex,
    UploadStatus uploadStatus,
    boolean finalChunk,
    String message) {

  static ChunkUploadResponse from(ChunkRef ref) {
    return new ChunkUploadResponse(
        ref.chunkId(),
        ref.sessionId(),
        ref.sequenceIndex(),
        ref.uploadStatus(),
        ref.finalChunk(),
        ref.message());
  }
}
