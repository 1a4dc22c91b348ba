package com.scholary.transcriber.chunk;

/**
 * An incoming chunk upload.
 *
 * @param sessionId caller-supplied session id
 * @param sequenceIndex position of the chunk in the session, starting at 0
 * @param fileName original file name; its extension selects the audio format
 * @param contentType MIME type as sent by the client, may be null
 * @param data audio bytes
 * @param overlapSeconds seconds of audio shared with the previous chunk
 * @param totalChunks expected number of chunks in the session, or null if not known yet
 * @param questionId opaque tag linking the chunk to an interview question, may be null
 */
public record ChunkUpload(
    String sessionId,
    int sequenceIndex,
    String fileName,
    String contentType,
    byte[] data,
    double overlapSeconds,
    Integer totalChunks,
    String questionId) {}
