package com.scholary.transcriber.tts;

/**
 * Outcome of a synthesis request.
 *
 * @param key cache key of the audio
 * @param fileUrl path the audio can be fetched from
 * @param contentType MIME type of the audio
 * @param sizeBytes audio size
 * @param durationSeconds estimated playback duration
 * @param voice voice used
 * @param format audio format
 * @param cached whether the audio was served from the cache
 */
public record SpeechResult(
    String key,
    String fileUrl,
    String contentType,
    long sizeBytes,
    Double durationSeconds,
    String voice,
    String format,
    boolean cached) {}
