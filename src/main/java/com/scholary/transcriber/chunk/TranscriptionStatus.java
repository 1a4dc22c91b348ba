package com.scholary.transcriber.chunk;

/** Transcription state of a chunk. COMPLETED and FAILED are terminal. */
public enum TranscriptionStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
