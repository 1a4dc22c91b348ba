package com.scholary.transcriber.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes every session event to the log. */
@Component
public class LoggingEventListener implements SessionEventListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEventListener.class);

  @Override
  public void onEvent(SessionEvent event) {
    if (event instanceof SessionCompletedEvent completed) {
      LOGGER.info(
          "Session completed: session={}, chunks={}/{}, confidence={}",
          completed.sessionId(),
          completed.transcript().completedChunks(),
          completed.transcript().totalChunks(),
          completed.transcript().confidenceScore());
    } else {
      LOGGER.info("Session event: session={}, type={}", event.sessionId(), event.type());
    }
  }
}
