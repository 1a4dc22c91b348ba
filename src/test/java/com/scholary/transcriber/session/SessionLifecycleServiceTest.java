package com.scholary.transcriber.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.cache.ContentAddressedCache;
import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.events.EventNotifier;
import com.scholary.transcriber.events.SessionCompletedEvent;
import com.scholary.transcriber.events.SessionEvent;
import com.scholary.transcriber.events.SessionFailedEvent;
import com.scholary.transcriber.exception.AggregationUnavailableException;
import com.scholary.transcriber.exception.ConflictException;
import com.scholary.transcriber.exception.SessionNotFoundException;
import com.scholary.transcriber.session.SessionLifecycleService.AcceptedChunk;
import com.scholary.transcriber.testutil.Chunks;
import com.scholary.transcriber.testutil.SyncExecutor;
import com.scholary.transcriber.testutil.TestProperties;
import com.scholary.transcriber.transcript.AggregatedTranscript;
import com.scholary.transcriber.transcript.TranscriptAggregator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private EventNotifier notifier;
  @Mock private ContentAddressedCache cache;

  private ChunkRepository chunkRepository;
  private SessionRepository sessionRepository;
  private SessionLifecycleService lifecycle;

  @BeforeEach
  void setUp() {
    chunkRepository = new ChunkRepository();
    sessionRepository = new SessionRepository();
    lifecycle =
        new SessionLifecycleService(
            sessionRepository,
            chunkRepository,
            new TranscriptAggregator(chunkRepository, TestProperties.transcription()),
            notifier,
            cache,
            new SyncExecutor(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void acceptChunk_createsSessionAndStartsReceiving() {
    Session session = lifecycle.acceptChunk(Chunks.pending("s1", 0), null).session();

    assertThat(session.status()).isEqualTo(SessionStatus.RECEIVING);
    assertThat(session.uploadedChunks()).isEqualTo(1);
    assertThat(session.totalChunksExpected()).isNull();
    assertThat(session.createdAt()).isEqualTo(NOW);
  }

  @Test
  void acceptChunk_latestTotalWins() {
    lifecycle.acceptChunk(Chunks.pending("s1", 0), 5);
    lifecycle.acceptChunk(Chunks.pending("s1", 1), null);

    Session session = lifecycle.acceptChunk(Chunks.pending("s1", 2), 3).session();

    assertThat(session.totalChunksExpected()).isEqualTo(3);
    assertThat(session.uploadedChunks()).isEqualTo(3);
  }

  @Test
  void acceptChunk_returnsReplacedRow() {
    Chunk first = Chunks.pending("s1", 0);
    lifecycle.acceptChunk(first, null);

    AcceptedChunk accepted = lifecycle.acceptChunk(Chunks.pending("s1", 0), null);

    assertThat(accepted.replaced()).contains(first);
    assertThat(accepted.session().uploadedChunks()).isEqualTo(1);
  }

  @Test
  void acceptChunk_closedSessionRejectsChunkWithoutWritingRow() {
    storeCompleted(0, "done", 1);
    lifecycle.evaluateCompletion("s1");

    assertThatThrownBy(() -> lifecycle.acceptChunk(Chunks.pending("s1", 1), null))
        .isInstanceOf(ConflictException.class);

    assertThat(chunkRepository.find("s1", 1)).isEmpty();
    assertThat(status()).isEqualTo(SessionStatus.COMPLETED);
  }

  @Test
  void acceptChunk_failedUploadKeepsEarlierRowAndSessionStatus() {
    Chunk stored = Chunks.pending("s1", 0);
    lifecycle.acceptChunk(stored, null);

    AcceptedChunk accepted = lifecycle.acceptChunk(Chunks.uploadFailed("s1", 0), null);

    assertThat(accepted.replaced()).isEmpty();
    assertThat(chunkRepository.find("s1", 0)).contains(stored);

    Session fresh = lifecycle.acceptChunk(Chunks.uploadFailed("s2", 0), 3).session();
    assertThat(fresh.status()).isEqualTo(SessionStatus.OPEN);
    assertThat(fresh.uploadedChunks()).isZero();
    assertThat(chunkRepository.find("s2", 0)).isPresent();
  }

  @Test
  void evaluateCompletion_cacheCleanupFailureDoesNotBreakCompletion() {
    when(cache.cleanup()).thenThrow(new IllegalStateException("store offline"));
    storeCompleted(0, "only chunk", 1);

    assertThat(lifecycle.evaluateCompletion("s1")).isPresent();

    assertThat(status()).isEqualTo(SessionStatus.COMPLETED);
    verify(notifier).publish(any(SessionCompletedEvent.class));
  }

  @Test
  void evaluateCompletion_completesOnceFinalChunkIsDone() {
    storeCompleted(0, "good morning everyone", 3);
    assertThat(lifecycle.evaluateCompletion("s1")).isEmpty();
    assertThat(status()).isEqualTo(SessionStatus.RECEIVING);

    storeCompleted(1, "welcome to the interview", 3);
    assertThat(lifecycle.evaluateCompletion("s1")).isEmpty();
    assertThat(status()).isEqualTo(SessionStatus.RECEIVING);

    storeCompleted(2, "let us begin", 3);
    Optional<AggregatedTranscript> transcript = lifecycle.evaluateCompletion("s1");

    assertThat(transcript).isPresent();
    assertThat(transcript.get().fullTranscript())
        .isEqualTo("good morning everyone welcome to the interview let us begin");
    Session session = sessionRepository.findById("s1").orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.COMPLETED);
    assertThat(session.completedAt()).isEqualTo(NOW);

    assertThat(lifecycle.evaluateCompletion("s1")).isEmpty();
    verify(notifier, times(1)).publish(any(SessionCompletedEvent.class));
    verify(cache, times(1)).cleanup();
  }

  @Test
  void evaluateCompletion_waitsForOutstandingChunks() {
    storeCompleted(0, "first", 2);
    lifecycle.acceptChunk(Chunks.pending("s1", 1), 2);

    assertThat(lifecycle.evaluateCompletion("s1")).isEmpty();
    assertThat(status()).isEqualTo(SessionStatus.RECEIVING);
    verify(notifier, never()).publish(any());
  }

  @Test
  void evaluateCompletion_failsSessionWithoutTranscribedChunks() {
    lifecycle.acceptChunk(Chunks.failed("s1", 0), 1);

    assertThat(lifecycle.evaluateCompletion("s1")).isEmpty();

    Session session = sessionRepository.findById("s1").orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.FAILED);
    assertThat(session.failureReason()).contains("No chunk was transcribed");
    assertThat(session.completedAt()).isNull();
    verify(notifier).publish(any(SessionFailedEvent.class));
    verify(cache, never()).cleanup();
  }

  @Test
  void evaluateCompletion_concurrentCallersCloseSessionOnce() throws Exception {
    storeCompleted(0, "only chunk", 1);

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Optional<AggregatedTranscript>>> calls = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        calls.add(() -> lifecycle.evaluateCompletion("s1"));
      }
      int winners = 0;
      for (Future<Optional<AggregatedTranscript>> result : executor.invokeAll(calls)) {
        if (result.get().isPresent()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }

    ArgumentCaptor<SessionEvent> events = ArgumentCaptor.forClass(SessionEvent.class);
    verify(notifier, times(1)).publish(events.capture());
    assertThat(events.getValue()).isInstanceOf(SessionCompletedEvent.class);
  }

  @Test
  void finalizeSession_aggregatesWhateverIsDone() {
    storeCompleted(0, "partial answer", 4);
    lifecycle.acceptChunk(Chunks.pending("s1", 1), null);

    AggregatedTranscript transcript = lifecycle.finalizeSession("s1");

    assertThat(transcript.fullTranscript()).isEqualTo("partial answer");
    assertThat(transcript.totalChunks()).isEqualTo(2);
    assertThat(status()).isEqualTo(SessionStatus.COMPLETED);
    verify(notifier).publish(any(SessionCompletedEvent.class));
  }

  @Test
  void finalizeSession_withoutTranscribedChunksFailsSession() {
    lifecycle.acceptChunk(Chunks.failed("s1", 0), null);

    assertThatThrownBy(() -> lifecycle.finalizeSession("s1"))
        .isInstanceOf(AggregationUnavailableException.class);

    assertThat(status()).isEqualTo(SessionStatus.FAILED);
    verify(notifier).publish(any(SessionFailedEvent.class));
  }

  @Test
  void finalizeSession_closedSessionConflicts() {
    storeCompleted(0, "done", 1);
    lifecycle.evaluateCompletion("s1");

    assertThatThrownBy(() -> lifecycle.finalizeSession("s1"))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void finalizeSession_unknownSession() {
    assertThatThrownBy(() -> lifecycle.finalizeSession("missing"))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void requireAcceptingChunks_rejectsClosedSession() {
    storeCompleted(0, "done", 1);
    lifecycle.evaluateCompletion("s1");

    assertThatThrownBy(() -> lifecycle.requireAcceptingChunks("s1"))
        .isInstanceOf(ConflictException.class);
  }

  private void storeCompleted(int index, String text, Integer total) {
    lifecycle.acceptChunk(Chunks.completed("s1", index, text, 0.9), total);
  }

  private SessionStatus status() {
    return sessionRepository.findById("s1").orElseThrow().status();
  }
}
