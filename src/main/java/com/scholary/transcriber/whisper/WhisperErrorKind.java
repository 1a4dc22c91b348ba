package com.scholary.transcriber.whisper;

/** Classification of a failed transcription attempt. */
public enum WhisperErrorKind {
  TIMEOUT(true),
  RATE_LIMITED(true),
  SERVER_ERROR(true),
  NETWORK(true),
  /** The provider refused the request (bad audio, bad credentials). Retrying will not help. */
  REJECTED(false),
  INTERRUPTED(false);

  private final boolean retryable;

  WhisperErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
