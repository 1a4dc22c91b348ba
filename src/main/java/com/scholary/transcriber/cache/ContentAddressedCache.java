package com.scholary.transcriber.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.exception.NotFoundException;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cache for deterministic, expensive artifacts keyed by a fingerprint of their inputs.
 *
 * <p>The index lives in a Caffeine async cache; artifact bytes live in the object store under
 * {@code cache/{namespace}/{key}}. The first caller to miss on a key installs a pending future and
 * computes on its own thread, outside any map lock. Concurrent callers for the same key wait on
 * that future and see a hit, while lookups, reads and cleanup for other keys are never held up.
 *
 * <p>Eviction is explicit: {@link #cleanup()} runs on a schedule and after each completed session.
 */
@Component
public class ContentAddressedCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentAddressedCache.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final AsyncCache<String, CacheEntry> index = Caffeine.newBuilder().buildAsync();
  private final ObjectStoreClient objectStore;
  private final CacheProperties properties;
  private final Clock clock;

  public ContentAddressedCache(
      ObjectStoreClient objectStore, CacheProperties properties, Clock clock) {
    this.objectStore = objectStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Return the cached artifact for {@code inputs}, computing and storing it on a miss.
   *
   * <p>An entry whose blob has disappeared counts as a miss. If {@code compute} throws, nothing is
   * stored and the exception propagates.
   */
  public CacheResult getOrCompute(FingerprintInputs inputs, Supplier<ComputedArtifact> compute) {
    String key = inputs.fingerprint();
    while (true) {
      CompletableFuture<CacheEntry> pending = new CompletableFuture<>();
      CompletableFuture<CacheEntry> existing = index.asMap().putIfAbsent(key, pending);
      if (existing == null) {
        CacheEntry entry = computeAndStore(key, inputs.namespace(), compute, pending);
        STRUCTURED_LOGGER.logCacheLookup(inputs.namespace(), key, false);
        return new CacheResult(entry, false);
      }

      CacheEntry current;
      try {
        current = existing.join();
      } catch (CompletionException | CancellationException e) {
        // the owning caller failed and removed its future; retry as a fresh miss
        LOGGER.debug("Concurrent computation of {} failed: {}", key, e.getMessage());
        continue;
      }
      if (!objectStore.exists(current.payloadRef())) {
        index.asMap().remove(key, existing);
        continue;
      }
      CacheEntry hit = current.hit();
      if (index.asMap().replace(key, existing, CompletableFuture.completedFuture(hit))) {
        STRUCTURED_LOGGER.logCacheLookup(inputs.namespace(), key, true);
        return new CacheResult(hit, true);
      }
    }
  }

  /**
   * Read an artifact for serving. An entry still being computed is not found yet.
   *
   * @throws NotFoundException if the key is unknown or its blob is gone
   */
  public CachedArtifact read(String key) {
    CompletableFuture<CacheEntry> future = index.getIfPresent(key);
    CacheEntry entry = completed(future);
    if (entry == null) {
      throw new NotFoundException("Cache entry not found: " + key);
    }
    if (!objectStore.exists(entry.payloadRef())) {
      index.asMap().remove(key, future);
      throw new NotFoundException("Cache entry not found: " + key);
    }
    return new CachedArtifact(entry, objectStore.getObjectBytes(entry.payloadRef()));
  }

  /**
   * Remove expired entries and their blobs.
   *
   * <p>The age limit is {@code maxAge}, or {@code aggressiveMaxAge} when the total size is over
   * {@code maxTotalBytes}.
   */
  public synchronized CleanupReport cleanup() {
    long totalBytes = totalBytes();
    Duration maxAge =
        totalBytes > properties.maxTotalBytes()
            ? properties.aggressiveMaxAge()
            : properties.maxAge();
    Instant cutoff = clock.instant().minus(maxAge);

    List<CacheEntry> expired = new ArrayList<>();
    for (CacheEntry entry : entries()) {
      if (entry.createdAt().isBefore(cutoff)) {
        expired.add(entry);
      }
    }

    int removed = 0;
    long freed = 0;
    for (CacheEntry entry : expired) {
      AtomicBoolean evicted = new AtomicBoolean(false);
      index
          .asMap()
          .computeIfPresent(
              entry.key(),
              (k, current) -> {
                CacheEntry done = completed(current);
                if (done != null && done.createdAt().isBefore(cutoff)) {
                  evicted.set(true);
                  return null;
                }
                return current;
              });
      if (!evicted.get()) {
        continue;
      }
      try {
        objectStore.deleteObject(entry.payloadRef());
      } catch (ObjectStoreException e) {
        LOGGER.warn("Failed to delete cached blob {}: {}", entry.payloadRef(), e.getMessage());
      }
      removed++;
      freed += entry.sizeBytes();
    }

    STRUCTURED_LOGGER.logCacheCleanup(removed, freed);
    return new CleanupReport(removed, freed, totalBytes());
  }

  @Scheduled(
      fixedDelayString = "${cache.cleanup-interval-ms:3600000}",
      initialDelayString = "${cache.cleanup-interval-ms:3600000}")
  public void scheduledCleanup() {
    cleanup();
  }

  public long totalBytes() {
    long total = 0;
    for (CacheEntry entry : entries()) {
      total += entry.sizeBytes();
    }
    return total;
  }

  public CacheInfo info() {
    List<CacheEntry> entries = entries();
    long bytes = 0;
    long hits = 0;
    Instant oldest = null;
    for (CacheEntry entry : entries) {
      bytes += entry.sizeBytes();
      hits += entry.hitCount();
      if (oldest == null || entry.createdAt().isBefore(oldest)) {
        oldest = entry.createdAt();
      }
    }
    return new CacheInfo(entries.size(), bytes, properties.maxTotalBytes(), hits, oldest);
  }

  /** Completed entries; computations in flight are left out. */
  List<CacheEntry> entries() {
    List<CacheEntry> entries = new ArrayList<>();
    for (CompletableFuture<CacheEntry> future : index.asMap().values()) {
      CacheEntry entry = completed(future);
      if (entry != null) {
        entries.add(entry);
      }
    }
    return entries;
  }

  private CacheEntry computeAndStore(
      String key,
      String namespace,
      Supplier<ComputedArtifact> compute,
      CompletableFuture<CacheEntry> pending) {
    try {
      CacheEntry entry = store(key, namespace, compute.get());
      pending.complete(entry);
      return entry;
    } catch (RuntimeException e) {
      index.asMap().remove(key, pending);
      pending.completeExceptionally(e);
      throw e;
    }
  }

  private static CacheEntry completed(CompletableFuture<CacheEntry> future) {
    if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
      return null;
    }
    return future.join();
  }

  private CacheEntry store(String key, String namespace, ComputedArtifact artifact) {
    String payloadRef = "cache/" + namespace + "/" + key;
    objectStore.putObject(payloadRef, artifact.data(), artifact.contentType());
    LOGGER.debug("Cached artifact {} ({} bytes)", payloadRef, artifact.data().length);
    return new CacheEntry(
        key,
        namespace,
        payloadRef,
        artifact.contentType(),
        artifact.data().length,
        artifact.durationSeconds(),
        clock.instant(),
        0);
  }
}
