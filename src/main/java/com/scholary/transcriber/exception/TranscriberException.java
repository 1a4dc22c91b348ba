package com.scholary.transcriber.exception;

/**
 * Base class for failures raised by the transcriber.
 *
 * <p>Unchecked, like the rest of the service's exceptions. The web layer maps subclasses to HTTP
 * status codes in {@link GlobalExceptionHandler}.
 */
public class TranscriberException extends RuntimeException {

  public TranscriberException(String message) {
    super(message);
  }

  public TranscriberException(String message, Throwable cause) {
    super(message, cause);
  }
}
