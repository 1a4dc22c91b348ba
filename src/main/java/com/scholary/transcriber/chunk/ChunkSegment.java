package com.scholary.transcriber.chunk;

/**
 * A transcribed segment of one chunk, timed relative to the start of that chunk.
 *
 * @param start segment start in seconds
 * @param end segment end in seconds
 * @param text segment text
 * @param confidence confidence in [0, 1]
 */
public record ChunkSegment(double start, double end, String text, double confidence) {}
