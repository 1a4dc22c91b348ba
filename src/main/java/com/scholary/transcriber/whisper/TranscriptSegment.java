package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>Times are relative to the start of the chunk that was transcribed. {@code avgLogprob} may be
 * missing for providers that do not report it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(
    double start, double end, String text, @JsonProperty("avg_logprob") Double avgLogprob) {

  public double duration() {
    return Math.max(0.0, end - start);
  }
}
