package com.scholary.transcriber.exception;

/** Thrown when a requested resource does not exist. */
public class NotFoundException extends TranscriberException {

  public NotFoundException(String message) {
    super(message);
  }
}
