package com.scholary.transcriber.cache;

public record CacheResult(CacheEntry entry, boolean wasCached) {}
