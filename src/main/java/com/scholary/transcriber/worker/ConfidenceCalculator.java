package com.scholary.transcriber.worker;

import com.scholary.transcriber.whisper.TranscriptSegment;
import com.scholary.transcriber.whisper.WhisperResponse;
import java.util.List;

/** Derives confidence and duration figures from a provider response. */
public final class ConfidenceCalculator {

  private ConfidenceCalculator() {}

  /** {@code exp(avg_logprob)} clamped to [0, 1]; 0.0 when the provider gave no log probability. */
  public static double segmentConfidence(TranscriptSegment segment) {
    Double logprob = segment.avgLogprob();
    if (logprob == null || logprob.isNaN()) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, Math.exp(logprob)));
  }

  /**
   * Duration-weighted mean of segment confidences.
   *
   * <p>Zero-length segments carry no weight. Returns 0.0 if no segment has a positive duration.
   */
  public static double chunkConfidence(List<TranscriptSegment> segments) {
    double weighted = 0.0;
    double totalWeight = 0.0;
    for (TranscriptSegment segment : segments) {
      double weight = segment.duration();
      if (weight <= 0) {
        continue;
      }
      weighted += segmentConfidence(segment) * weight;
      totalWeight += weight;
    }
    return totalWeight > 0 ? weighted / totalWeight : 0.0;
  }

  /** Audio length reported by the provider, else the end of the last segment, else 0. */
  public static double chunkDuration(WhisperResponse response) {
    if (response.duration() != null) {
      return response.duration();
    }
    List<TranscriptSegment> segments = response.segments();
    return segments.isEmpty() ? 0.0 : segments.get(segments.size() - 1).end();
  }
}
