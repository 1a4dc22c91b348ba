package com.scholary.transcriber.session;

import java.util.Map;

/**
 * Storage usage across all sessions and the artifact cache.
 *
 * @param activeSessions sessions still OPEN or RECEIVING
 * @param storedAudioBytes size of every chunk whose audio was stored
 */
public record StorageStatistics(
    int totalSessions,
    int activeSessions,
    Map<SessionStatus, Integer> sessionsByStatus,
    int totalChunks,
    long storedAudioBytes,
    double averageChunkSizeBytes,
    int cacheEntries,
    long cacheBytes) {}
