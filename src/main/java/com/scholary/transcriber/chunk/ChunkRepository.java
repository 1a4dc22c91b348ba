package com.scholary.transcriber.chunk;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for chunk rows.
 *
 * <p>Rows are grouped per session in a sorted map keyed by sequence index, held in a Caffeine
 * cache. Entries never expire on their own; the retention job removes whole sessions. Writes for a
 * session go through {@code asMap().compute} so concurrent uploads to the same session are
 * serialized.
 */
@Repository
public class ChunkRepository {

  private final Cache<String, ConcurrentSkipListMap<Integer, Chunk>> cache =
      Caffeine.newBuilder().recordStats().build();

  /**
   * Insert or replace the row for (sessionId, sequenceIndex).
   *
   * @return the row that was replaced, if any
   */
  public Optional<Chunk> save(Chunk chunk) {
    AtomicReference<Chunk> previous = new AtomicReference<>();
    cache
        .asMap()
        .compute(
            chunk.sessionId(),
            (sessionId, rows) -> {
              ConcurrentSkipListMap<Integer, Chunk> target =
                  rows != null ? rows : new ConcurrentSkipListMap<>();
              previous.set(target.put(chunk.sequenceIndex(), chunk));
              return target;
            });
    return Optional.ofNullable(previous.get());
  }

  /**
   * Apply {@code update} to the row only if it still carries {@code chunkId}.
   *
   * <p>This is how workers write results: if the chunk was replaced by a newer upload in the
   * meantime, nothing is written.
   *
   * @return the updated row, or empty if the row is gone, was replaced, or the update returned null
   */
  public Optional<Chunk> updateIfCurrent(
      String sessionId, int sequenceIndex, String chunkId, UnaryOperator<Chunk> update) {
    AtomicReference<Chunk> result = new AtomicReference<>();
    cache
        .asMap()
        .computeIfPresent(
            sessionId,
            (id, rows) -> {
              rows.computeIfPresent(
                  sequenceIndex,
                  (index, current) -> {
                    if (!current.chunkId().equals(chunkId)) {
                      return current;
                    }
                    Chunk updated = update.apply(current);
                    if (updated == null) {
                      return current;
                    }
                    result.set(updated);
                    return updated;
                  });
              return rows;
            });
    return Optional.ofNullable(result.get());
  }

  public Optional<Chunk> find(String sessionId, int sequenceIndex) {
    ConcurrentSkipListMap<Integer, Chunk> rows = cache.getIfPresent(sessionId);
    return rows == null ? Optional.empty() : Optional.ofNullable(rows.get(sequenceIndex));
  }

  /** All rows of a session ordered by sequence index. */
  public List<Chunk> findBySession(String sessionId) {
    ConcurrentSkipListMap<Integer, Chunk> rows = cache.getIfPresent(sessionId);
    return rows == null ? List.of() : new ArrayList<>(rows.values());
  }

  /** Rows of every session. */
  public List<Chunk> findAll() {
    List<Chunk> all = new ArrayList<>();
    for (ConcurrentSkipListMap<Integer, Chunk> rows : cache.asMap().values()) {
      all.addAll(rows.values());
    }
    return all;
  }

  /**
   * Remove all rows of a session.
   *
   * @return the removed rows
   */
  public List<Chunk> deleteSession(String sessionId) {
    ConcurrentSkipListMap<Integer, Chunk> rows = cache.asMap().remove(sessionId);
    return rows == null ? List.of() : new ArrayList<>(rows.values());
  }
}
