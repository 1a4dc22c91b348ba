package com.scholary.transcriber.cache;

public record CleanupReport(int removedEntries, long freedBytes, long remainingBytes) {}
