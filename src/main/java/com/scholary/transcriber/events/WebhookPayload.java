package com.scholary.transcriber.events;

import java.time.Instant;

/** JSON body posted to webhook URLs. {@code data} is the event itself. */
public record WebhookPayload(String type, String sessionId, Instant occurredAt, Object data) {

  public static WebhookPayload of(SessionEvent event) {
    return new WebhookPayload(event.type(), event.sessionId(), event.occurredAt(), event);
  }
}
