package com.scholary.transcriber.session;

/** Session lifecycle: OPEN to RECEIVING to COMPLETED, or FAILED from any non-terminal state. */
public enum SessionStatus {
  OPEN,
  RECEIVING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
