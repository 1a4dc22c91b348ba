package com.scholary.transcriber.session;

import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.SessionNotFoundException;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Removes closed sessions once they are older than the retention period.
 *
 * <p>Only COMPLETED and FAILED sessions are eligible for the scheduled purge; their chunk rows and
 * audio blobs go with them. Sessions still receiving chunks are only removed by an explicit
 * {@link #deleteSession}. Rows are removed inside the session's compute, so an upload racing the
 * removal either lands before it and is removed too, or starts a new session afterwards.
 */
@Service
public class SessionRetentionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRetentionService.class);

  private final SessionRepository sessionRepository;
  private final ChunkRepository chunkRepository;
  private final ObjectStoreClient objectStore;
  private final Duration maxAge;
  private final Clock clock;

  public SessionRetentionService(
      SessionRepository sessionRepository,
      ChunkRepository chunkRepository,
      ObjectStoreClient objectStore,
      TranscriptionProperties properties,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.chunkRepository = chunkRepository;
    this.objectStore = objectStore;
    this.maxAge = Duration.ofDays(properties.retention().maxAgeDays());
    this.clock = clock;
  }

  /**
   * Delete expired sessions.
   *
   * @return counts of removed sessions, chunk rows and blobs
   */
  public RetentionReport purgeExpired() {
    Instant cutoff = clock.instant().minus(maxAge);
    int sessions = 0;
    int chunks = 0;
    int blobs = 0;

    for (Session session : sessionRepository.findAll()) {
      Optional<SessionDeletion> deletion =
          remove(
              session.sessionId(),
              current -> current.status().isTerminal() && current.createdAt().isBefore(cutoff));
      if (deletion.isPresent()) {
        sessions++;
        chunks += deletion.get().deletedChunks();
        blobs += deletion.get().deletedBlobs();
      }
    }

    LOGGER.info(
        "Retention cleanup finished: {} sessions, {} chunks, {} blobs removed",
        sessions,
        chunks,
        blobs);
    return new RetentionReport(sessions, chunks, blobs);
  }

  /**
   * Delete one session now, whatever its status, with its chunk rows and audio blobs.
   *
   * <p>Transcriptions still in flight for the session find no row to update and are dropped.
   *
   * @throws SessionNotFoundException if the session does not exist
   */
  public SessionDeletion deleteSession(String sessionId) {
    SessionDeletion deletion =
        remove(sessionId, session -> true)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    LOGGER.info(
        "Deleted session {} with {} chunks and {} blobs",
        sessionId,
        deletion.deletedChunks(),
        deletion.deletedBlobs());
    return deletion;
  }

  @Scheduled(
      fixedDelayString = "${transcription.retention.interval-ms:86400000}",
      initialDelayString = "${transcription.retention.interval-ms:86400000}")
  public void scheduledPurge() {
    purgeExpired();
  }

  private Optional<SessionDeletion> remove(String sessionId, Predicate<Session> eligible) {
    List<Chunk> removedChunks = new ArrayList<>();
    Optional<Session> removed =
        sessionRepository.removeIf(
            sessionId,
            eligible,
            session -> removedChunks.addAll(chunkRepository.deleteSession(sessionId)));
    if (removed.isEmpty()) {
      return Optional.empty();
    }
    int blobs = 0;
    for (Chunk chunk : removedChunks) {
      if (chunk.blobKey() != null && deleteBlob(chunk.blobKey())) {
        blobs++;
      }
    }
    return Optional.of(new SessionDeletion(sessionId, removedChunks.size(), blobs));
  }

  private boolean deleteBlob(String blobKey) {
    try {
      objectStore.deleteObject(blobKey);
      return true;
    } catch (ObjectStoreException e) {
      LOGGER.warn("Failed to delete chunk blob {}: {}", blobKey, e.getMessage());
      return false;
    }
  }

  public record RetentionReport(int deletedSessions, int deletedChunks, int deletedBlobs) {}

  public record SessionDeletion(String sessionId, int deletedChunks, int deletedBlobs) {}
}
