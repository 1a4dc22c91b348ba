package com.scholary.transcriber.chunk;

import com.scholary.transcriber.events.ChunkUploadedEvent;
import com.scholary.transcriber.events.EventNotifier;
import com.scholary.transcriber.exception.ConflictException;
import com.scholary.transcriber.exception.SessionNotFoundException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import com.scholary.transcriber.session.Session;
import com.scholary.transcriber.session.SessionLifecycleService;
import com.scholary.transcriber.session.SessionLifecycleService.AcceptedChunk;
import com.scholary.transcriber.session.SessionRepository;
import com.scholary.transcriber.worker.TranscriptionTask;
import com.scholary.transcriber.worker.TranscriptionWorkerPool;
import java.net.URLConnection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts chunk uploads and keeps the chunk rows of each session.
 *
 * <p>An upload is stored blob first, then the row is swapped in, and only then is the blob of a
 * replaced row deleted. A reader therefore never sees a row pointing at a missing blob. If the
 * session closes while the blob is being written, the blob is removed again and the upload is
 * rejected. Uploading
 * the same (session, index) twice replaces the earlier chunk: it gets a new chunk id and goes back
 * to PENDING.
 */
@Service
public class ChunkStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkStore.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ChunkRepository chunkRepository;
  private final SessionRepository sessionRepository;
  private final ChunkValidator validator;
  private final ObjectStoreClient objectStore;
  private final SessionLifecycleService lifecycle;
  private final TranscriptionWorkerPool workerPool;
  private final EventNotifier notifier;
  private final Clock clock;

  public ChunkStore(
      ChunkRepository chunkRepository,
      SessionRepository sessionRepository,
      ChunkValidator validator,
      ObjectStoreClient objectStore,
      SessionLifecycleService lifecycle,
      TranscriptionWorkerPool workerPool,
      EventNotifier notifier,
      Clock clock) {
    this.chunkRepository = chunkRepository;
    this.sessionRepository = sessionRepository;
    this.validator = validator;
    this.objectStore = objectStore;
    this.lifecycle = lifecycle;
    this.workerPool = workerPool;
    this.notifier = notifier;
    this.clock = clock;
  }

  /**
   * Store a chunk and queue it for transcription.
   *
   * @throws com.scholary.transcriber.exception.ValidationException if the upload is invalid
   * @throws com.scholary.transcriber.exception.ConflictException if the session is already closed
   * @throws ObjectStoreException if the audio could not be stored
   */
  public ChunkRef upsertChunk(ChunkUpload upload) {
    String extension = validator.validate(upload);
    lifecycle.requireAcceptingChunks(upload.sessionId());

    StructuredLogger.setSessionContext(upload.sessionId());
    try {
      String chunkId = UUID.randomUUID().toString();
      String contentType = contentType(upload, extension);
      String blobKey =
          String.format(
              "sessions/%s/chunk_%04d_%s.%s",
              upload.sessionId(), upload.sequenceIndex(), chunkId, extension);
      Instant now = clock.instant();

      try {
        objectStore.putObject(blobKey, upload.data(), contentType);
      } catch (ObjectStoreException e) {
        recordFailedUpload(upload, chunkId, extension, contentType, e, now);
        throw e;
      }

      Chunk chunk =
          Chunk.pending(
              upload.sessionId(),
              upload.sequenceIndex(),
              chunkId,
              upload.questionId(),
              upload.overlapSeconds(),
              upload.fileName(),
              extension,
              contentType,
              upload.data().length,
              blobKey,
              now);
      AcceptedChunk accepted;
      try {
        accepted = lifecycle.acceptChunk(chunk, upload.totalChunks());
      } catch (ConflictException e) {
        // the session closed while the audio was being written
        deleteBlob(blobKey, "rejected");
        throw e;
      }
      Optional<Chunk> previous = accepted.replaced();
      previous.map(Chunk::blobKey).ifPresent(key -> deleteBlob(key, "replaced"));

      Session session = accepted.session();
      boolean finalChunk = session.isFinalIndex(upload.sequenceIndex());
      STRUCTURED_LOGGER.logChunkUploaded(
          upload.sequenceIndex(), chunkId, upload.data().length, previous.isPresent());

      workerPool.submit(
          new TranscriptionTask(upload.sessionId(), upload.sequenceIndex(), chunkId));
      notifier.publish(
          new ChunkUploadedEvent(
              upload.sessionId(),
              chunkId,
              upload.sequenceIndex(),
              upload.questionId(),
              upload.data().length,
              finalChunk,
              now));
      lifecycle.evaluateCompletion(upload.sessionId());

      return new ChunkRef(
          chunkId,
          upload.sessionId(),
          upload.sequenceIndex(),
          UploadStatus.UPLOADED,
          finalChunk,
          finalChunk ? "Final chunk uploaded" : "Chunk uploaded successfully");
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  /**
   * Session fields plus per-chunk status.
   *
   * @throws SessionNotFoundException if the session does not exist
   */
  public SessionSummary getSessionSummary(String sessionId) {
    Session session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    List<Chunk> chunks = chunkRepository.findBySession(sessionId);

    int processed = 0;
    int failed = 0;
    for (Chunk chunk : chunks) {
      if (chunk.isCompleted()) {
        processed++;
      }
      if (!chunk.isUploaded() || chunk.transcriptionStatus() == TranscriptionStatus.FAILED) {
        failed++;
      }
    }

    return new SessionSummary(
        session.sessionId(),
        session.status(),
        session.totalChunksExpected(),
        session.uploadedChunks(),
        processed,
        failed,
        session.totalDurationSeconds(),
        session.createdAt(),
        session.updatedAt(),
        session.completedAt(),
        session.failureReason(),
        chunks.stream().map(ChunkStatusView::of).toList());
  }

  private void recordFailedUpload(
      ChunkUpload upload,
      String chunkId,
      String extension,
      String contentType,
      ObjectStoreException cause,
      Instant now) {
    LOGGER.error(
        "Failed to store chunk {} of session {}: {}",
        upload.sequenceIndex(),
        upload.sessionId(),
        cause.getMessage());
    Chunk failed =
        Chunk.uploadFailed(
            upload.sessionId(),
            upload.sequenceIndex(),
            chunkId,
            upload.questionId(),
            upload.overlapSeconds(),
            upload.fileName(),
            extension,
            contentType,
            upload.data().length,
            cause.getMessage(),
            now);
    try {
      lifecycle.acceptChunk(failed, upload.totalChunks());
    } catch (ConflictException e) {
      cause.addSuppressed(e);
    }
  }

  private void deleteBlob(String blobKey, String reason) {
    try {
      objectStore.deleteObject(blobKey);
    } catch (ObjectStoreException e) {
      LOGGER.warn("Failed to delete {} chunk blob {}: {}", reason, blobKey, e.getMessage());
    }
  }

  private static String contentType(ChunkUpload upload, String extension) {
    if (upload.contentType() != null
        && !upload.contentType().isBlank()
        && !"application/octet-stream".equals(upload.contentType())) {
      return upload.contentType();
    }
    String guessed = URLConnection.guessContentTypeFromName("chunk." + extension);
    return guessed != null ? guessed : "audio/" + extension;
  }
}
