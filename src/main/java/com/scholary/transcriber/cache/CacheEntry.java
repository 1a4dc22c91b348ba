package com.scholary.transcriber.cache;

import java.time.Instant;

/**
 * Index record of a cached artifact.
 *
 * @param key fingerprint of the inputs
 * @param namespace kind of artifact, e.g. {@code tts}
 * @param payloadRef object-store key of the artifact bytes
 * @param contentType MIME type of the artifact
 * @param sizeBytes artifact size
 * @param durationSeconds playback duration for audio artifacts, otherwise null
 * @param createdAt when the artifact was computed
 * @param hitCount number of lookups served from the cache
 */
public record CacheEntry(
    String key,
    String namespace,
    String payloadRef,
    String contentType,
    long sizeBytes,
    Double durationSeconds,
    Instant createdAt,
    long hitCount) {

  public CacheEntry hit() {
    return new CacheEntry(
        key, namespace, payloadRef, contentType, sizeBytes, durationSeconds, createdAt,
        hitCount + 1);
  }
}
