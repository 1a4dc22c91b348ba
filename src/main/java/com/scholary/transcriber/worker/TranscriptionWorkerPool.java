package com.scholary.transcriber.worker;

import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.chunk.ChunkSegment;
import com.scholary.transcriber.chunk.TranscriptionStatus;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.WorkerProperties;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.session.SessionLifecycleService;
import com.scholary.transcriber.whisper.AudioClip;
import com.scholary.transcriber.whisper.TranscriptSegment;
import com.scholary.transcriber.whisper.WhisperOutcome;
import com.scholary.transcriber.whisper.WhisperResponse;
import com.scholary.transcriber.whisper.WhisperService;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Transcribes stored chunks in the background.
 *
 * <p>Tasks go into a shared FIFO queue. Every submit also schedules a drain on the bounded
 * transcription executor, so at most {@code transcription.workers.threads} workers pull from the
 * queue at once. There is no ordering between chunks; the aggregator sorts by sequence index.
 *
 * <p>Per task a worker claims the chunk (PENDING to PROCESSING), reads its audio and calls the
 * provider up to {@code maxAttempts} times. Only retryable failures are retried, with exponential
 * backoff. The attempt counter and last error are written to the chunk after every attempt. If the
 * chunk is replaced by a new upload while in flight, the result is discarded.
 */
@Component
public class TranscriptionWorkerPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionWorkerPool.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final BlockingQueue<TranscriptionTask> queue = new LinkedBlockingQueue<>();
  private final ChunkRepository chunkRepository;
  private final ObjectStoreClient objectStore;
  private final WhisperService whisperService;
  private final SessionLifecycleService lifecycle;
  private final Executor executor;
  private final WorkerProperties properties;
  private final Clock clock;

  public TranscriptionWorkerPool(
      ChunkRepository chunkRepository,
      ObjectStoreClient objectStore,
      WhisperService whisperService,
      SessionLifecycleService lifecycle,
      @Qualifier("transcriptionExecutor") Executor executor,
      TranscriptionProperties properties,
      Clock clock) {
    this.chunkRepository = chunkRepository;
    this.objectStore = objectStore;
    this.whisperService = whisperService;
    this.lifecycle = lifecycle;
    this.executor = executor;
    this.properties = properties.workers();
    this.clock = clock;
  }

  /** Queue a chunk for transcription. Never blocks. */
  public void submit(TranscriptionTask task) {
    queue.add(task);
    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      // the task stays queued and is picked up by the next drain
      LOGGER.warn(
          "Transcription executor saturated, {} tasks waiting: {}", queue.size(), e.getMessage());
    }
  }

  /** Number of tasks waiting for a worker. */
  public int pendingTasks() {
    return queue.size();
  }

  void drain() {
    TranscriptionTask task;
    while ((task = queue.poll()) != null) {
      process(task);
    }
  }

  void process(TranscriptionTask task) {
    StructuredLogger.setSessionContext(task.sessionId());
    try {
      Optional<Chunk> claimed =
          chunkRepository.updateIfCurrent(
              task.sessionId(),
              task.sequenceIndex(),
              task.chunkId(),
              chunk ->
                  chunk.transcriptionStatus() == TranscriptionStatus.PENDING
                      ? chunk.processing()
                      : null);
      if (claimed.isEmpty()) {
        LOGGER.debug(
            "Skipping task for chunk {} of session {}: replaced or already claimed",
            task.sequenceIndex(),
            task.sessionId());
        return;
      }
      transcribe(task, claimed.get());
    } catch (RuntimeException e) {
      LOGGER.error(
          "Unexpected failure transcribing chunk {} of session {}",
          task.sequenceIndex(),
          task.sessionId(),
          e);
      chunkRepository
          .updateIfCurrent(
              task.sessionId(),
              task.sequenceIndex(),
              task.chunkId(),
              chunk ->
                  chunk.transcriptionStatus().isTerminal()
                      ? null
                      : chunk.failed(chunk.attempts(), "Internal error: " + e, clock.instant()))
          .ifPresent(chunk -> lifecycle.onChunkProcessed(task.sessionId()));
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  private void transcribe(TranscriptionTask task, Chunk chunk) {
    byte[] audio;
    try {
      audio = objectStore.getObjectBytes(chunk.blobKey());
    } catch (ObjectStoreException e) {
      STRUCTURED_LOGGER.logTranscribeFailed(
          chunk.sequenceIndex(), 0, "STORAGE", e.getMessage());
      finish(
          task,
          current -> current.failed(0, "Failed to read audio: " + e.getMessage(), clock.instant()));
      return;
    }

    AudioClip clip =
        new AudioClip(
            audio,
            String.format("chunk_%04d.%s", chunk.sequenceIndex(), chunk.fileExtension()),
            chunk.contentType());
    int maxAttempts = properties.maxAttempts();

    for (int attempt = 1; ; attempt++) {
      STRUCTURED_LOGGER.logTranscribeStarted(chunk.sequenceIndex(), chunk.chunkId(), attempt);
      long startMs = System.currentTimeMillis();
      WhisperOutcome outcome = whisperService.transcribe(clip);
      long transcribeMs = System.currentTimeMillis() - startMs;

      if (outcome.isSuccess()) {
        complete(task, outcome.response(), attempt, transcribeMs);
        return;
      }

      String error = outcome.errorKind() + ": " + outcome.error();
      if (!outcome.isRetryable() || attempt >= maxAttempts) {
        STRUCTURED_LOGGER.logTranscribeFailed(
            chunk.sequenceIndex(), attempt, outcome.errorKind().name(), outcome.error());
        int attempts = attempt;
        finish(task, current -> current.failed(attempts, error, clock.instant()));
        return;
      }

      int attempts = attempt;
      Optional<Chunk> recorded =
          chunkRepository.updateIfCurrent(
              task.sessionId(),
              task.sequenceIndex(),
              task.chunkId(),
              current -> current.attemptFailed(attempts, error));
      if (recorded.isEmpty()) {
        LOGGER.info(
            "Chunk {} of session {} was replaced during transcription, dropping result",
            task.sequenceIndex(),
            task.sessionId());
        return;
      }
      STRUCTURED_LOGGER.logTranscribeRetry(
          chunk.sequenceIndex(), attempt, maxAttempts, outcome.errorKind().name(), outcome.error());

      if (!sleep(backoff(attempt))) {
        finish(
            task,
            current -> current.failed(attempts, "Interrupted during backoff", clock.instant()));
        return;
      }
    }
  }

  private void complete(
      TranscriptionTask task, WhisperResponse response, int attempt, long transcribeMs) {
    List<ChunkSegment> segments =
        response.segments().stream()
            .map(
                segment ->
                    new ChunkSegment(
                        segment.start(),
                        segment.end(),
                        segment.text() == null ? "" : segment.text().strip(),
                        ConfidenceCalculator.segmentConfidence(segment)))
            .collect(Collectors.toList());
    double confidence = ConfidenceCalculator.chunkConfidence(response.segments());
    double duration = ConfidenceCalculator.chunkDuration(response);
    String text = transcriptText(response);

    boolean written =
        finish(
            task,
            current ->
                current.completed(
                    text,
                    segments,
                    confidence,
                    duration,
                    response.language(),
                    attempt,
                    clock.instant()));
    if (written) {
      STRUCTURED_LOGGER.logTranscribeFinished(
          task.sequenceIndex(), duration, confidence, transcribeMs);
    }
  }

  /**
   * Write a terminal state if the chunk is still the one the task was for, then let the lifecycle
   * re-evaluate the session.
   */
  private boolean finish(TranscriptionTask task, UnaryOperator<Chunk> update) {
    Optional<Chunk> updated =
        chunkRepository.updateIfCurrent(
            task.sessionId(), task.sequenceIndex(), task.chunkId(), update);
    if (updated.isEmpty()) {
      LOGGER.info(
          "Chunk {} of session {} was replaced during transcription, dropping result",
          task.sequenceIndex(),
          task.sessionId());
      return false;
    }
    lifecycle.onChunkProcessed(task.sessionId());
    return true;
  }

  private static String transcriptText(WhisperResponse response) {
    String text = response.text().strip();
    if (!text.isEmpty() || response.segments().isEmpty()) {
      return text;
    }
    return response.segments().stream()
        .map(TranscriptSegment::text)
        .filter(segmentText -> segmentText != null && !segmentText.isBlank())
        .map(String::strip)
        .collect(Collectors.joining(" "));
  }

  /** {@code initialBackoff * 2^(attempt-1)}, capped at {@code maxBackoff}. */
  Duration backoff(int attempt) {
    Duration delay = properties.initialBackoff().multipliedBy(1L << Math.min(attempt - 1, 30));
    return delay.compareTo(properties.maxBackoff()) > 0 ? properties.maxBackoff() : delay;
  }

  private static boolean sleep(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
