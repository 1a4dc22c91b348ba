package com.scholary.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.exception.NotFoundException;
import com.scholary.transcriber.testutil.Chunks;
import com.scholary.transcriber.testutil.TestProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptAggregatorTest {

  private static final String SESSION = "session-1";

  private ChunkRepository chunkRepository;
  private TranscriptAggregator aggregator;

  @BeforeEach
  void setUp() {
    chunkRepository = new ChunkRepository();
    aggregator = new TranscriptAggregator(chunkRepository, TestProperties.transcription());
  }

  @Test
  void aggregate_ordersBySequenceIndex() {
    chunkRepository.save(Chunks.completed(SESSION, 2, "charlie", 0.8));
    chunkRepository.save(Chunks.completed(SESSION, 0, "alpha", 0.8));
    chunkRepository.save(Chunks.completed(SESSION, 1, "bravo", 0.8));

    AggregatedTranscript result = aggregator.aggregate(SESSION);

    assertThat(result.fullTranscript()).isEqualTo("alpha bravo charlie");
    assertThat(result.segments())
        .extracting(MergedSegment::sequenceIndex)
        .containsExactly(0, 1, 2);
  }

  @Test
  void aggregate_removesWordsRepeatedAcrossChunkBoundary() {
    chunkRepository.save(
        Chunks.completed(SESSION, 0, "the quick brown fox jumps over the lazy dog", 0.9));
    chunkRepository.save(Chunks.completed(SESSION, 1, "over the lazy dog and then runs away", 0.9));

    AggregatedTranscript result = aggregator.aggregate(SESSION);

    assertThat(result.fullTranscript())
        .isEqualTo("the quick brown fox jumps over the lazy dog and then runs away");
  }

  @Test
  void aggregate_sharedWindowEndingMidWordAppearsOnce() {
    String first = "alpha bravo charlie delta echo foxtrot golf hotel india juliet kilo";
    String shared = first.substring(first.length() - 50);
    chunkRepository.save(Chunks.completed(SESSION, 0, first, 0.9));
    chunkRepository.save(Chunks.completed(SESSION, 1, shared + "meter lima mike", 0.9));

    String transcript = aggregator.aggregate(SESSION).fullTranscript();

    assertThat(transcript).isEqualTo(first + "meter lima mike").endsWith("kilometer lima mike");
    assertThat(transcript.indexOf(shared)).isEqualTo(transcript.lastIndexOf(shared));
  }

  @Test
  void aggregate_keepsPunctuationAfterOverlap() {
    chunkRepository.save(Chunks.completed(SESSION, 0, "hello there", 0.9));
    chunkRepository.save(Chunks.completed(SESSION, 1, "there, how are you", 0.9));

    assertThat(aggregator.aggregate(SESSION).fullTranscript())
        .isEqualTo("hello there, how are you");
  }

  @Test
  void aggregate_noOverlapWindowKeepsRepeatedWords() {
    chunkRepository.save(Chunks.completed(SESSION, 0, "hello there", 0.9));
    chunkRepository.save(
        Chunks.pending(SESSION, 1, 0.0)
            .processing()
            .completed("there, how are you", List.of(), 0.9, 3.0, "en", 1, null));

    assertThat(aggregator.aggregate(SESSION).fullTranscript())
        .isEqualTo("hello there there, how are you");
  }

  @Test
  void aggregate_averagesConfidenceOverCompletedChunksOnly() {
    chunkRepository.save(Chunks.completed(SESSION, 0, "first part", 0.9, 10.0));
    chunkRepository.save(Chunks.completed(SESSION, 1, "second part", 0.6, 12.0));
    chunkRepository.save(Chunks.failed(SESSION, 2));

    AggregatedTranscript result = aggregator.aggregate(SESSION);

    assertThat(result.totalChunks()).isEqualTo(3);
    assertThat(result.completedChunks()).isEqualTo(2);
    assertThat(result.confidenceScore()).isCloseTo(0.75, within(1e-9));
    assertThat(result.durationSeconds()).isCloseTo(22.0, within(1e-9));
    assertThat(result.fullTranscript()).isEqualTo("first part second part");
  }

  @Test
  void aggregate_pendingChunksCountButContributeNothing() {
    chunkRepository.save(Chunks.completed(SESSION, 0, "only this", 0.7));
    chunkRepository.save(Chunks.pending(SESSION, 1));

    AggregatedTranscript result = aggregator.aggregate(SESSION);

    assertThat(result.totalChunks()).isEqualTo(2);
    assertThat(result.completedChunks()).isEqualTo(1);
    assertThat(result.fullTranscript()).isEqualTo("only this");
  }

  @Test
  void aggregate_noCompletedChunksGivesEmptyTranscript() {
    chunkRepository.save(Chunks.failed(SESSION, 0));

    AggregatedTranscript result = aggregator.aggregate(SESSION);

    assertThat(result.fullTranscript()).isEmpty();
    assertThat(result.confidenceScore()).isZero();
    assertThat(result.segments()).isEmpty();
  }

  @Test
  void aggregate_isIdempotent() {
    chunkRepository.save(Chunks.completed(SESSION, 0, "hello there", 0.9));
    chunkRepository.save(Chunks.completed(SESSION, 1, "there, how are you", 0.8));

    assertThat(aggregator.aggregate(SESSION)).isEqualTo(aggregator.aggregate(SESSION));
  }

  @Test
  void aggregate_unknownSessionThrowsNotFound() {
    assertThatThrownBy(() -> aggregator.aggregate("missing"))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void windowFor_defaultOverlapSearchesFiftyCharacters() {
    assertThat(aggregator.windowFor(2.0)).isEqualTo(50);
    assertThat(aggregator.windowFor(60.0)).isEqualTo(200);
    assertThat(aggregator.windowFor(0.0)).isZero();
  }
}
