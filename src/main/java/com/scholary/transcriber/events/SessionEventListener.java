package com.scholary.transcriber.events;

/**
 * Receives session events from the {@link EventNotifier}.
 *
 * <p>Implementations may block and may throw; the notifier runs them off the caller's thread and
 * logs failures.
 */
public interface SessionEventListener {

  void onEvent(SessionEvent event) throws Exception;
}
