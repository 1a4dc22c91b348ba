package com.scholary.transcriber.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.scholary.transcriber.testutil.Chunks;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GapDetectorTest {

  private ChunkRepository chunkRepository;
  private GapDetector gapDetector;

  @BeforeEach
  void setUp() {
    chunkRepository = new ChunkRepository();
    gapDetector = new GapDetector(chunkRepository);
  }

  @Test
  void findGaps_reportsMissingIndex() {
    for (int index : new int[] {0, 1, 3, 4}) {
      chunkRepository.save(Chunks.pending("s1", index));
    }

    assertThat(gapDetector.findGaps("s1")).containsExactly(2);
  }

  @Test
  void findGaps_contiguousChunksHaveNoGaps() {
    for (int index = 0; index < 4; index++) {
      chunkRepository.save(Chunks.pending("s1", index));
    }

    assertThat(gapDetector.findGaps("s1")).isEmpty();
  }

  @Test
  void findGaps_onlyConsidersRangeOfStoredIndices() {
    chunkRepository.save(Chunks.pending("s1", 3));
    chunkRepository.save(Chunks.pending("s1", 6));

    assertThat(gapDetector.findGaps("s1")).containsExactly(4, 5);
  }

  @Test
  void findGaps_sessionWithoutChunks() {
    assertThat(gapDetector.findGaps("unknown")).isEmpty();
  }

  @Test
  void findGaps_failedUploadsCountAsMissing() {
    chunkRepository.save(Chunks.pending("s1", 0));
    chunkRepository.save(
        Chunk.uploadFailed(
            "s1", 1, "c-1", null, 2.0, "chunk.webm", "webm", "audio/webm", 10, "disk full",
            Instant.now()));
    chunkRepository.save(Chunks.pending("s1", 2));

    assertThat(gapDetector.findGaps("s1")).containsExactly(1);
  }

  @Test
  void findGaps_terminatesAtHighestRepresentableIndex() {
    chunkRepository.save(Chunks.pending("s1", Integer.MAX_VALUE - 2));
    chunkRepository.save(Chunks.pending("s1", Integer.MAX_VALUE));

    assertThat(assertTimeoutPreemptively(Duration.ofSeconds(5), () -> gapDetector.findGaps("s1")))
        .containsExactly(Integer.MAX_VALUE - 1);
  }
}
