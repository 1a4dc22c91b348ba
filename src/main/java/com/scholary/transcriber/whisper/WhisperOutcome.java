package com.scholary.transcriber.whisper;

/**
 * Result of a single transcription attempt: either a response or a classified failure.
 *
 * <p>Failures are values rather than exceptions so the caller can decide on retries from the
 * {@link WhisperErrorKind}.
 */
public record WhisperOutcome(WhisperResponse response, WhisperErrorKind errorKind, String error) {

  public static WhisperOutcome success(WhisperResponse response) {
    return new WhisperOutcome(response, null, null);
  }

  public static WhisperOutcome failure(WhisperErrorKind kind, String error) {
    return new WhisperOutcome(null, kind, error);
  }

  public boolean isSuccess() {
    return response != null;
  }

  public boolean isRetryable() {
    return errorKind != null && errorKind.isRetryable();
  }
}
