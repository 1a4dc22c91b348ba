package com.scholary.transcriber.events;

import com.scholary.transcriber.exception.NotificationDeliveryException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans session events out to every registered {@link SessionEventListener}.
 *
 * <p>Delivery is best-effort and at-most-once: each listener gets one attempt on the notification
 * executor. Failures are logged and never reach the code that published the event.
 */
@Component
public class EventNotifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventNotifier.class);

  private final List<SessionEventListener> listeners;
  private final Executor executor;

  public EventNotifier(
      List<SessionEventListener> listeners,
      @Qualifier("notificationExecutor") Executor executor) {
    this.listeners = List.copyOf(listeners);
    this.executor = executor;
  }

  public void publish(SessionEvent event) {
    for (SessionEventListener listener : listeners) {
      try {
        executor.execute(() -> deliver(listener, event));
      } catch (RejectedExecutionException e) {
        report(
            new NotificationDeliveryException(
                "Notification queue full, dropping " + event.type() + " event", e),
            event);
      }
    }
  }

  private void deliver(SessionEventListener listener, SessionEvent event) {
    try {
      listener.onEvent(event);
    } catch (Exception e) {
      report(
          new NotificationDeliveryException(
              listener.getClass().getSimpleName() + " failed to handle " + event.type(), e),
          event);
    }
  }

  private void report(NotificationDeliveryException e, SessionEvent event) {
    LOGGER.warn(
        "Event delivery failed: session={}, type={}, reason={}",
        event.sessionId(),
        event.type(),
        e.getMessage(),
        e);
  }
}
