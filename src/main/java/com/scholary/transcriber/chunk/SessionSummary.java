package com.scholary.transcriber.chunk;

import com.scholary.transcriber.session.SessionStatus;
import java.time.Instant;
import java.util.List;

/**
 * Session state plus per-chunk progress.
 *
 * @param processedChunks chunks with a completed transcription
 * @param failedChunks chunks whose upload or transcription failed
 */
public record SessionSummary(
    String sessionId,
    SessionStatus status,
    Integer totalChunksExpected,
    int uploadedChunks,
    int processedChunks,
    int failedChunks,
    double totalDurationSeconds,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    String failureReason,
    List<ChunkStatusView> chunks) {}
