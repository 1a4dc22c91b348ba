package com.scholary.transcriber.exception;

/**
 * Raised when an event could not be handed to a listener.
 *
 * <p>Never propagated to callers; the notifier logs it and moves on.
 */
public class NotificationDeliveryException extends TranscriberException {

  public NotificationDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
