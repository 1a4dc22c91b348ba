package com.scholary.transcriber.worker;

/**
 * A queued request to transcribe one upload of a chunk.
 *
 * <p>{@code chunkId} pins the task to a specific upload; if the chunk is replaced before a worker
 * gets to it, the task is dropped.
 */
public record TranscriptionTask(String sessionId, int sequenceIndex, String chunkId) {}
