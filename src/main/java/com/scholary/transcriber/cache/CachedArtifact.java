package com.scholary.transcriber.cache;

/** Artifact bytes read back for serving. */
public record CachedArtifact(CacheEntry entry, byte[] data) {}
