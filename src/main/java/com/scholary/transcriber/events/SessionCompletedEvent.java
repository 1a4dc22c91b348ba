package com.scholary.transcriber.events;

import com.scholary.transcriber.transcript.AggregatedTranscript;
import java.time.Instant;

/** Published once when a session reaches COMPLETED. Carries the aggregated transcript. */
public record SessionCompletedEvent(
    String sessionId, AggregatedTranscript transcript, Instant occurredAt)
    implements SessionEvent {

  @Override
  public String type() {
    return "session-completed";
  }
}
