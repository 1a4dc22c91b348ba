package com.scholary.transcriber.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for chunk ingestion, transcription workers and aggregation.
 *
 * <p>Controls upload limits, worker pool sizing, retry policy, the overlap heuristic and session
 * retention.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Valid @NotNull IngestProperties ingest,
    @Valid @NotNull WorkerProperties workers,
    @Valid @NotNull AggregationProperties aggregation,
    @Valid @NotNull RetentionProperties retention) {

  public record IngestProperties(
      @Positive long maxFileSizeBytes,
      @NotEmpty List<String> allowedExtensions,
      @PositiveOrZero double defaultOverlapSeconds,
      @Positive int maxSequenceIndex) {}

  public record WorkerProperties(
      @Positive int threads,
      @Positive int queueCapacity,
      @Positive int maxAttempts,
      @NotNull Duration initialBackoff,
      @NotNull Duration maxBackoff) {}

  /**
   * Overlap heuristic tuning.
   *
   * <p>The search window for a chunk is {@code overlapSeconds * wordsPerSecond * charsPerWord}
   * characters, capped at {@code maxOverlapChars}. With the defaults a 2 second overlap searches 50
   * characters.
   */
  public record AggregationProperties(
      @Positive double wordsPerSecond,
      @Positive int charsPerWord,
      @Positive int maxOverlapChars,
      @Positive int minMatchChars) {}

  public record RetentionProperties(@Positive int maxAgeDays, @Positive long intervalMs) {}
}
