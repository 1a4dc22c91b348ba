package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the transcription API in {@code verbose_json} form.
 *
 * <p>{@code duration} is the audio length reported by the provider and may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(
    String text, List<TranscriptSegment> segments, String language, Double duration) {

  public WhisperResponse {
    segments = segments == null ? List.of() : List.copyOf(segments);
    text = text == null ? "" : text;
  }
}
