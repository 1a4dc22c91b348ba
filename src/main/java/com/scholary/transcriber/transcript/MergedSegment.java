package com.scholary.transcriber.transcript;

/**
 * A transcript segment in the aggregated output.
 *
 * <p>Timing is relative to the start of the chunk it came from, identified by {@code
 * sequenceIndex}. Segments are not re-based to session-wide offsets.
 */
public record MergedSegment(
    int sequenceIndex, double start, double end, String text, double confidence) {}
