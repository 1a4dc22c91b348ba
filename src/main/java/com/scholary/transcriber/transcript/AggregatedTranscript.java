package com.scholary.transcriber.transcript;

import java.util.List;

/**
 * The merged transcript of a session as of the moment it was aggregated.
 *
 * @param sessionId the session
 * @param fullTranscript ordered, overlap-deduplicated text of all completed chunks
 * @param totalChunks number of stored chunks, whatever their status
 * @param completedChunks number of chunks that contributed text
 * @param confidenceScore mean confidence over completed chunks, 0.0 when there are none
 * @param durationSeconds summed duration of completed chunks
 * @param segments segments of all completed chunks in chunk order
 */
public record AggregatedTranscript(
    String sessionId,
    String fullTranscript,
    int totalChunks,
    int completedChunks,
    double confidenceScore,
    double durationSeconds,
    List<MergedSegment> segments) {}
