package com.scholary.transcriber.exception;

/** Thrown when an operation is not allowed in the current state of a resource. */
public class ConflictException extends TranscriberException {

  public ConflictException(String message) {
    super(message);
  }
}
