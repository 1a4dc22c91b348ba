package com.scholary.transcriber.exception;

/** Thrown when request input is rejected before any state is touched. */
public class ValidationException extends TranscriberException {

  private final String field;

  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
