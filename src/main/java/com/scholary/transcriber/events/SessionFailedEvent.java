package com.scholary.transcriber.events;

import java.time.Instant;

public record SessionFailedEvent(String sessionId, String reason, Instant occurredAt)
    implements SessionEvent {

  @Override
  public String type() {
    return "session-failed";
  }
}
