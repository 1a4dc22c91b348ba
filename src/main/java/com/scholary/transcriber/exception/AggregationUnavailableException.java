package com.scholary.transcriber.exception;

/** Thrown when a transcript is requested for a session with no completed chunks. */
public class AggregationUnavailableException extends TranscriberException {

  public AggregationUnavailableException(String message) {
    super(message);
  }
}
