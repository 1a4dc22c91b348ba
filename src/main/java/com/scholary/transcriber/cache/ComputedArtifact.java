package com.scholary.transcriber.cache;

/** What a cache miss computes: the artifact bytes plus their metadata. */
public record ComputedArtifact(byte[] data, String contentType, Double durationSeconds) {}
