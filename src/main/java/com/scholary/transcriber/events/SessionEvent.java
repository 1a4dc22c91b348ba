package com.scholary.transcriber.events;

import java.time.Instant;

/** Something that happened to a session and is reported to downstream consumers. */
public interface SessionEvent {

  String sessionId();

  /** Stable event name, used as the {@code type} field of webhook payloads. */
  String type();

  Instant occurredAt();
}
