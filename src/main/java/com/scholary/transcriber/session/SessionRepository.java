package com.scholary.transcriber.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for sessions.
 *
 * <p>Backed by a Caffeine cache without expiry; sessions are only removed by the retention job.
 * All state changes go through {@code asMap().compute} so a transition is atomic per session.
 */
@Repository
public class SessionRepository {

  private final Cache<String, Session> cache = Caffeine.newBuilder().build();

  /** Apply {@code update} to the session, creating it in OPEN first if it does not exist. */
  public Session upsert(String sessionId, Instant now, UnaryOperator<Session> update) {
    return cache
        .asMap()
        .compute(
            sessionId,
            (id, current) -> update.apply(current != null ? current : Session.open(id, now)));
  }

  /**
   * Apply {@code update} to an existing session. Returning the same instance leaves it unchanged.
   *
   * @return the session after the update, or empty if it does not exist
   */
  public Optional<Session> update(String sessionId, UnaryOperator<Session> update) {
    return Optional.ofNullable(
        cache.asMap().computeIfPresent(sessionId, (id, current) -> update.apply(current)));
  }

  public Optional<Session> findById(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId));
  }

  public List<Session> findAll() {
    return new ArrayList<>(cache.asMap().values());
  }

  /**
   * Remove the session if {@code eligible} accepts it, running {@code onRemove} within the same
   * atomic step.
   *
   * @return the removed session, or empty if it does not exist or was not eligible
   */
  public Optional<Session> removeIf(
      String sessionId, Predicate<Session> eligible, Consumer<Session> onRemove) {
    AtomicReference<Session> removed = new AtomicReference<>();
    cache
        .asMap()
        .computeIfPresent(
            sessionId,
            (id, current) -> {
              if (!eligible.test(current)) {
                return current;
              }
              onRemove.accept(current);
              removed.set(current);
              return null;
            });
    return Optional.ofNullable(removed.get());
  }
}
