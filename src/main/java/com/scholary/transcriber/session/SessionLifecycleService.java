package com.scholary.transcriber.session;

import com.scholary.transcriber.cache.ContentAddressedCache;
import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.events.EventNotifier;
import com.scholary.transcriber.events.SessionCompletedEvent;
import com.scholary.transcriber.events.SessionFailedEvent;
import com.scholary.transcriber.exception.AggregationUnavailableException;
import com.scholary.transcriber.exception.ConflictException;
import com.scholary.transcriber.exception.SessionNotFoundException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.transcript.AggregatedTranscript;
import com.scholary.transcriber.transcript.TranscriptAggregator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives the session state machine.
 *
 * <p>Sessions move OPEN to RECEIVING on the first stored chunk. After every upload and every
 * finished transcription, {@link #evaluateCompletion} checks whether the final chunk is stored and
 * every stored chunk is done; if so the session is aggregated and closed. The transition runs
 * inside the repository's per-session compute, so exactly one caller closes a session and only
 * that caller publishes the event.
 *
 * <p>A session closes COMPLETED if at least one chunk was transcribed, FAILED otherwise.
 */
@Service
public class SessionLifecycleService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionLifecycleService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SessionRepository sessionRepository;
  private final ChunkRepository chunkRepository;
  private final TranscriptAggregator aggregator;
  private final EventNotifier notifier;
  private final ContentAddressedCache cache;
  private final Executor maintenanceExecutor;
  private final Clock clock;

  public SessionLifecycleService(
      SessionRepository sessionRepository,
      ChunkRepository chunkRepository,
      TranscriptAggregator aggregator,
      EventNotifier notifier,
      ContentAddressedCache cache,
      @Qualifier("maintenanceExecutor") Executor maintenanceExecutor,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.chunkRepository = chunkRepository;
    this.aggregator = aggregator;
    this.notifier = notifier;
    this.cache = cache;
    this.maintenanceExecutor = maintenanceExecutor;
    this.clock = clock;
  }

  /**
   * Reject uploads to sessions that are already closed.
   *
   * @throws ConflictException if the session is COMPLETED or FAILED
   */
  public void requireAcceptingChunks(String sessionId) {
    sessionRepository
        .findById(sessionId)
        .filter(session -> session.status().isTerminal())
        .ifPresent(
            session -> {
              throw new ConflictException(
                  "Session " + sessionId + " is already " + session.status());
            });
  }

  /**
   * Save a chunk row and record it on its session, creating the session if needed.
   *
   * <p>The terminal check and the row write run inside the session's compute, so a chunk can never
   * land in a session that another thread has just closed. A row for a failed upload does not
   * replace an existing row of the same index and does not move the session out of OPEN.
   *
   * @param totalChunks expected chunk count supplied with the upload, or null
   * @throws ConflictException if the session is COMPLETED or FAILED; nothing is written
   */
  public AcceptedChunk acceptChunk(Chunk chunk, Integer totalChunks) {
    String sessionId = chunk.sessionId();
    Instant now = clock.instant();
    AtomicReference<SessionStatus> before = new AtomicReference<>();
    AtomicReference<Chunk> replaced = new AtomicReference<>();
    Session session =
        sessionRepository.upsert(
            sessionId,
            now,
            current -> {
              if (current.status().isTerminal()) {
                throw new ConflictException(
                    "Session " + sessionId + " is already " + current.status());
              }
              before.set(current.status());
              if (!chunk.isUploaded()
                  && chunkRepository.find(sessionId, chunk.sequenceIndex()).isPresent()) {
                return current;
              }
              chunkRepository.save(chunk).ifPresent(replaced::set);
              List<Chunk> chunks = chunkRepository.findBySession(sessionId);
              if (!chunk.isUploaded()) {
                return current.withStats(uploadedCount(chunks), duration(chunks), now);
              }
              return current.chunkStored(
                  totalChunks, uploadedCount(chunks), duration(chunks), now);
            });
    if (before.get() != session.status()) {
      STRUCTURED_LOGGER.logSessionTransition(
          sessionId, before.get().name(), session.status().name());
    }
    return new AcceptedChunk(session, Optional.ofNullable(replaced.get()));
  }

  /** Refresh session stats after a chunk reached a terminal status, then check for completion. */
  public void onChunkProcessed(String sessionId) {
    Instant now = clock.instant();
    sessionRepository.update(
        sessionId,
        current -> {
          List<Chunk> chunks = chunkRepository.findBySession(sessionId);
          return current.withStats(uploadedCount(chunks), duration(chunks), now);
        });
    evaluateCompletion(sessionId);
  }

  /**
   * Close the session if it is ready.
   *
   * @return the aggregate if this call completed the session
   */
  public Optional<AggregatedTranscript> evaluateCompletion(String sessionId) {
    AtomicReference<Closure> closure = new AtomicReference<>();
    sessionRepository.update(
        sessionId,
        current -> {
          if (current.status() != SessionStatus.RECEIVING) {
            return current;
          }
          List<Chunk> chunks = chunkRepository.findBySession(sessionId);
          if (!isReady(current, chunks)) {
            return current;
          }
          Closure result = close(current, chunks);
          closure.set(result);
          return result.session();
        });

    Closure result = closure.get();
    if (result == null) {
      return Optional.empty();
    }
    announce(result);
    return Optional.ofNullable(result.isCompleted() ? result.transcript() : null);
  }

  /**
   * Close the session now, whatever its chunks' state.
   *
   * @throws SessionNotFoundException if the session does not exist
   * @throws ConflictException if the session is already closed
   * @throws AggregationUnavailableException if no chunk was transcribed; the session is FAILED
   */
  public AggregatedTranscript finalizeSession(String sessionId) {
    AtomicReference<Closure> closure = new AtomicReference<>();
    AtomicReference<SessionStatus> terminal = new AtomicReference<>();
    Optional<Session> updated =
        sessionRepository.update(
            sessionId,
            current -> {
              if (current.status().isTerminal()) {
                terminal.set(current.status());
                return current;
              }
              Closure result = close(current, chunkRepository.findBySession(sessionId));
              closure.set(result);
              return result.session();
            });

    if (updated.isEmpty()) {
      throw new SessionNotFoundException(sessionId);
    }
    if (terminal.get() != null) {
      throw new ConflictException("Session " + sessionId + " is already " + terminal.get());
    }

    Closure result = closure.get();
    announce(result);
    if (!result.isCompleted()) {
      throw new AggregationUnavailableException(result.session().failureReason());
    }
    return result.transcript();
  }

  private Closure close(Session current, List<Chunk> chunks) {
    Instant now = clock.instant();
    AggregatedTranscript transcript =
        chunks.isEmpty() ? null : aggregator.aggregate(current.sessionId());
    if (transcript != null && transcript.completedChunks() > 0) {
      return new Closure(
          current.status(), current.complete(transcript.durationSeconds(), now), transcript);
    }
    String reason =
        chunks.isEmpty()
            ? "No chunks were uploaded"
            : "No chunk was transcribed successfully (" + chunks.size() + " stored)";
    return new Closure(current.status(), current.fail(reason, now), transcript);
  }

  private void announce(Closure closure) {
    Session session = closure.session();
    STRUCTURED_LOGGER.logSessionTransition(
        session.sessionId(), closure.from().name(), session.status().name());
    if (closure.isCompleted()) {
      notifier.publish(
          new SessionCompletedEvent(
              session.sessionId(), closure.transcript(), session.completedAt()));
      scheduleCacheCleanup();
    } else {
      notifier.publish(
          new SessionFailedEvent(
              session.sessionId(), session.failureReason(), session.updatedAt()));
    }
  }

  private void scheduleCacheCleanup() {
    try {
      maintenanceExecutor.execute(this::runCacheCleanup);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Cache cleanup already pending, skipping: {}", e.getMessage());
    }
  }

  private void runCacheCleanup() {
    try {
      cache.cleanup();
    } catch (RuntimeException e) {
      LOGGER.warn("Cache cleanup after session completion failed: {}", e.getMessage(), e);
    }
  }

  private static boolean isReady(Session session, List<Chunk> chunks) {
    if (session.totalChunksExpected() == null) {
      return false;
    }
    boolean finalStored =
        chunks.stream()
            .anyMatch(chunk -> chunk.isUploaded() && session.isFinalIndex(chunk.sequenceIndex()));
    return finalStored
        && chunks.stream().allMatch(chunk -> chunk.transcriptionStatus().isTerminal());
  }

  private static int uploadedCount(List<Chunk> chunks) {
    return (int) chunks.stream().filter(Chunk::isUploaded).count();
  }

  private static double duration(List<Chunk> chunks) {
    return chunks.stream()
        .filter(chunk -> chunk.durationSeconds() != null)
        .mapToDouble(Chunk::durationSeconds)
        .sum();
  }

  /** Outcome of {@link #acceptChunk}: the updated session and the row the chunk replaced. */
  public record AcceptedChunk(Session session, Optional<Chunk> replaced) {}

  private record Closure(SessionStatus from, Session session, AggregatedTranscript transcript) {

    boolean isCompleted() {
      return session.status() == SessionStatus.COMPLETED;
    }
  }
}
