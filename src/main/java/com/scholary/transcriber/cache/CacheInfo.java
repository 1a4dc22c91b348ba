package com.scholary.transcriber.cache;

import java.time.Instant;

/**
 * Snapshot of the cache index.
 *
 * @param oldestEntryAt creation time of the oldest entry, null when the cache is empty
 */
public record CacheInfo(
    int entries, long totalBytes, long maxTotalBytes, long totalHits, Instant oldestEntryAt) {}
