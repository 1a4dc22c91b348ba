package com.scholary.transcriber.chunk;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One uploaded piece of a session's audio and its transcription state.
 *
 * <p>Identified by (sessionId, sequenceIndex). Every upload gets a fresh {@code chunkId}, so a row
 * that was replaced can be told apart from its successor. Instances are immutable; state changes
 * produce a copy.
 *
 * <p>{@code transcriptText} is present exactly when the transcription status is COMPLETED.
 */
public record Chunk(
    String sessionId,
    int sequenceIndex,
    String chunkId,
    String questionId,
    double overlapSeconds,
    String fileName,
    String fileExtension,
    String contentType,
    long sizeBytes,
    String blobKey,
    UploadStatus uploadStatus,
    TranscriptionStatus transcriptionStatus,
    String transcriptText,
    List<ChunkSegment> segments,
    Double confidenceScore,
    Double durationSeconds,
    String language,
    int attempts,
    String lastError,
    Instant uploadedAt,
    Instant processedAt) {

  public Chunk {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(chunkId, "chunkId");
    Objects.requireNonNull(uploadStatus, "uploadStatus");
    Objects.requireNonNull(transcriptionStatus, "transcriptionStatus");
    if ((transcriptText != null) != (transcriptionStatus == TranscriptionStatus.COMPLETED)) {
      throw new IllegalArgumentException(
          "transcriptText must be set exactly when status is COMPLETED, status="
              + transcriptionStatus);
    }
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  /** A freshly stored chunk waiting for transcription. */
  public static Chunk pending(
      String sessionId,
      int sequenceIndex,
      String chunkId,
      String questionId,
      double overlapSeconds,
      String fileName,
      String fileExtension,
      String contentType,
      long sizeBytes,
      String blobKey,
      Instant uploadedAt) {
    return new Chunk(
        sessionId,
        sequenceIndex,
        chunkId,
        questionId,
        overlapSeconds,
        fileName,
        fileExtension,
        contentType,
        sizeBytes,
        blobKey,
        UploadStatus.UPLOADED,
        TranscriptionStatus.PENDING,
        null,
        List.of(),
        null,
        null,
        null,
        0,
        null,
        uploadedAt,
        null);
  }

  /** A chunk whose blob could not be written. It will never be transcribed. */
  public static Chunk uploadFailed(
      String sessionId,
      int sequenceIndex,
      String chunkId,
      String questionId,
      double overlapSeconds,
      String fileName,
      String fileExtension,
      String contentType,
      long sizeBytes,
      String error,
      Instant at) {
    return new Chunk(
        sessionId,
        sequenceIndex,
        chunkId,
        questionId,
        overlapSeconds,
        fileName,
        fileExtension,
        contentType,
        sizeBytes,
        null,
        UploadStatus.FAILED,
        TranscriptionStatus.FAILED,
        null,
        List.of(),
        null,
        null,
        null,
        0,
        error,
        at,
        at);
  }

  public Chunk processing() {
    return withState(
        TranscriptionStatus.PROCESSING, null, segments, confidenceScore, durationSeconds, language,
        attempts, lastError, processedAt);
  }

  /** Records a failed attempt that will be retried. */
  public Chunk attemptFailed(int attempt, String error) {
    return withState(
        transcriptionStatus, null, segments, confidenceScore, durationSeconds, language, attempt,
        error, processedAt);
  }

  public Chunk completed(
      String text,
      List<ChunkSegment> newSegments,
      double confidence,
      double duration,
      String detectedLanguage,
      int attempt,
      Instant at) {
    return withState(
        TranscriptionStatus.COMPLETED, text, newSegments, confidence, duration, detectedLanguage,
        attempt, lastError, at);
  }

  public Chunk failed(int attempt, String error, Instant at) {
    return withState(
        TranscriptionStatus.FAILED, null, List.of(), null, durationSeconds, language, attempt,
        error, at);
  }

  public boolean isUploaded() {
    return uploadStatus == UploadStatus.UPLOADED;
  }

  public boolean isCompleted() {
    return transcriptionStatus == TranscriptionStatus.COMPLETED;
  }

  private Chunk withState(
      TranscriptionStatus status,
      String text,
      List<ChunkSegment> newSegments,
      Double confidence,
      Double duration,
      String detectedLanguage,
      int attempt,
      String error,
      Instant at) {
    return new Chunk(
        sessionId,
        sequenceIndex,
        chunkId,
        questionId,
        overlapSeconds,
        fileName,
        fileExtension,
        contentType,
        sizeBytes,
        blobKey,
        uploadStatus,
        status,
        text,
        newSegments,
        confidence,
        duration,
        detectedLanguage,
        attempt,
        error,
        uploadedAt,
        at);
  }
}
