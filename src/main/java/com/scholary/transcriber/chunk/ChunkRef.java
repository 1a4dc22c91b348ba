package com.scholary.transcriber.chunk;

/** Returned to the uploader once a chunk is stored. */
public record ChunkRef(
    String chunkId,
    String sessionId,
    int sequenceIndex,
    UploadStatus uploadStatus,
    boolean finalChunk,
    String message) {}
