package com.scholary.transcriber.chunk;

public record ChunkStatusView(
    int sequenceIndex,
    String chunkId,
    String questionId,
    UploadStatus uploadStatus,
    TranscriptionStatus transcriptionStatus,
    int attempts,
    String lastError,
    Double confidenceScore,
    Double durationSeconds) {

  static ChunkStatusView of(Chunk chunk) {
    return new ChunkStatusView(
        chunk.sequenceIndex(),
        chunk.chunkId(),
        chunk.questionId(),
        chunk.uploadStatus(),
        chunk.transcriptionStatus(),
        chunk.attempts(),
        chunk.lastError(),
        chunk.confidenceScore(),
        chunk.durationSeconds());
  }
}
