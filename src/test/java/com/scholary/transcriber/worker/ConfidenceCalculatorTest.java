package com.scholary.transcriber.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.transcriber.whisper.TranscriptSegment;
import com.scholary.transcriber.whisper.WhisperResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfidenceCalculatorTest {

  @Test
  void segmentConfidence_isExponentOfAverageLogProbability() {
    TranscriptSegment segment = new TranscriptSegment(0, 1, "hi", Math.log(0.8));

    assertThat(ConfidenceCalculator.segmentConfidence(segment)).isCloseTo(0.8, within(1e-9));
  }

  @Test
  void segmentConfidence_clampedAndDefaulted() {
    assertThat(ConfidenceCalculator.segmentConfidence(new TranscriptSegment(0, 1, "x", 0.5)))
        .isEqualTo(1.0);
    assertThat(ConfidenceCalculator.segmentConfidence(new TranscriptSegment(0, 1, "x", null)))
        .isZero();
  }

  @Test
  void chunkConfidence_weightsByDuration() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0, 3, "long", Math.log(0.9)),
            new TranscriptSegment(3, 4, "short", Math.log(0.5)));

    // (0.9 * 3 + 0.5 * 1) / 4
    assertThat(ConfidenceCalculator.chunkConfidence(segments)).isCloseTo(0.8, within(1e-9));
  }

  @Test
  void chunkConfidence_zeroDurationSegmentsCarryNoWeight() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0, 2, "a", Math.log(0.6)),
            new TranscriptSegment(2, 2, "b", Math.log(0.1)));

    assertThat(ConfidenceCalculator.chunkConfidence(segments)).isCloseTo(0.6, within(1e-9));
    assertThat(ConfidenceCalculator.chunkConfidence(List.of(segments.get(1)))).isZero();
    assertThat(ConfidenceCalculator.chunkConfidence(List.of())).isZero();
  }

  @Test
  void chunkDuration_prefersProviderDuration() {
    List<TranscriptSegment> segments = List.of(new TranscriptSegment(0, 9.5, "a", null));

    assertThat(ConfidenceCalculator.chunkDuration(new WhisperResponse("a", segments, "en", 10.0)))
        .isEqualTo(10.0);
    assertThat(ConfidenceCalculator.chunkDuration(new WhisperResponse("a", segments, "en", null)))
        .isEqualTo(9.5);
    assertThat(ConfidenceCalculator.chunkDuration(new WhisperResponse("", null, "en", null)))
        .isZero();
  }
}
