package com.scholary.transcriber.exception;

public class SessionNotFoundException extends NotFoundException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }
}
