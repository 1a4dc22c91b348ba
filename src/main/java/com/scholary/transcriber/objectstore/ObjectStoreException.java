package com.scholary.transcriber.objectstore;

import com.scholary.transcriber.exception.TranscriberException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: a missing bucket or bad credentials is nothing the caller can fix, so it surfaces
 * as a server error.
 */
public class ObjectStoreException extends TranscriberException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
