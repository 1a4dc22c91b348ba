package com.scholary.transcriber.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import com.scholary.transcriber.exception.NotFoundException;
import com.scholary.transcriber.objectstore.LocalObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.testutil.MutableClock;
import com.scholary.transcriber.testutil.TestProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentAddressedCacheTest {

  @TempDir Path tempDir;

  private MutableClock clock;
  private ObjectStoreClient objectStore;
  private ContentAddressedCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    objectStore = new LocalObjectStoreClient(tempDir.toString());
    cache = new ContentAddressedCache(objectStore, TestProperties.cache(1_000), clock);
  }

  @Test
  void getOrCompute_computesOnceForIdenticalInputs() {
    AtomicInteger computations = new AtomicInteger();

    CacheResult first = cache.getOrCompute(inputs("hello"), artifact(computations, 10));
    CacheResult second = cache.getOrCompute(inputs("hello"), artifact(computations, 10));

    assertThat(computations).hasValue(1);
    assertThat(first.wasCached()).isFalse();
    assertThat(first.entry().hitCount()).isZero();
    assertThat(second.wasCached()).isTrue();
    assertThat(second.entry().hitCount()).isEqualTo(1);
    assertThat(second.entry().payloadRef()).isEqualTo(first.entry().payloadRef());
    assertThat(first.entry().payloadRef()).isEqualTo("cache/tts/" + first.entry().key());
  }

  @Test
  void getOrCompute_concurrentMissesComputeOnce() throws Exception {
    AtomicInteger computations = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<CacheResult>> calls = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        calls.add(() -> cache.getOrCompute(inputs("same"), artifact(computations, 5)));
      }
      executor.invokeAll(calls);
    } finally {
      executor.shutdownNow();
    }

    assertThat(computations).hasValue(1);
  }

  @Test
  void getOrCompute_slowComputationDoesNotBlockReadsOrCleanup() throws Exception {
    CacheResult stale = cache.getOrCompute(inputs("slow"), artifact(new AtomicInteger(), 10));
    CacheResult other = cache.getOrCompute(inputs("other"), artifact(new AtomicInteger(), 10));
    objectStore.deleteObject(stale.entry().payloadRef());
    clock.advance(Duration.ofHours(25));

    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<CacheResult> slow =
          executor.submit(
              () ->
                  cache.getOrCompute(
                      inputs("slow"),
                      () -> {
                        started.countDown();
                        awaitQuietly(release);
                        return new ComputedArtifact(new byte[20], "audio/wav", 2.0);
                      }));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      assertTimeoutPreemptively(
          Duration.ofSeconds(5),
          () -> {
            assertThatThrownBy(() -> cache.read(stale.entry().key()))
                .isInstanceOf(NotFoundException.class);
            CleanupReport report = cache.cleanup();
            assertThat(report.removedEntries()).isEqualTo(1);
            assertThat(objectStore.exists(other.entry().payloadRef())).isFalse();
          });

      release.countDown();
      CacheResult computed = slow.get(5, TimeUnit.SECONDS);
      assertThat(computed.wasCached()).isFalse();
      assertThat(cache.read(computed.entry().key()).data()).hasSize(20);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void getOrCompute_recomputesWhenBlobDisappeared() {
    AtomicInteger computations = new AtomicInteger();
    CacheResult first = cache.getOrCompute(inputs("hello"), artifact(computations, 10));
    objectStore.deleteObject(first.entry().payloadRef());

    CacheResult second = cache.getOrCompute(inputs("hello"), artifact(computations, 10));

    assertThat(computations).hasValue(2);
    assertThat(second.wasCached()).isFalse();
    assertThat(objectStore.exists(second.entry().payloadRef())).isTrue();
  }

  @Test
  void getOrCompute_failedComputationStoresNothing() {
    assertThatThrownBy(
            () ->
                cache.getOrCompute(
                    inputs("boom"),
                    () -> {
                      throw new IllegalStateException("provider down");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(cache.totalBytes()).isZero();
    assertThatThrownBy(() -> cache.read(inputs("boom").fingerprint()))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void read_returnsBytesAndContentType() {
    CacheResult result = cache.getOrCompute(inputs("hello"), artifact(new AtomicInteger(), 4));

    CachedArtifact artifact = cache.read(result.entry().key());

    assertThat(artifact.data()).hasSize(4);
    assertThat(artifact.entry().contentType()).isEqualTo("audio/wav");
  }

  @Test
  void info_summarizesEntriesAndHits() {
    Instant start = clock.instant();
    cache.getOrCompute(inputs("a"), artifact(new AtomicInteger(), 100));
    clock.advance(Duration.ofMinutes(5));
    cache.getOrCompute(inputs("b"), artifact(new AtomicInteger(), 50));
    cache.getOrCompute(inputs("a"), artifact(new AtomicInteger(), 100));
    cache.getOrCompute(inputs("a"), artifact(new AtomicInteger(), 100));

    CacheInfo info = cache.info();

    assertThat(info.entries()).isEqualTo(2);
    assertThat(info.totalBytes()).isEqualTo(150);
    assertThat(info.maxTotalBytes()).isEqualTo(1_000);
    assertThat(info.totalHits()).isEqualTo(2);
    assertThat(info.oldestEntryAt()).isEqualTo(start);
  }

  @Test
  void cleanup_removesEntriesOlderThanMaxAge() {
    CacheResult old = cache.getOrCompute(inputs("old"), artifact(new AtomicInteger(), 100));
    clock.advance(Duration.ofHours(20));
    cache.getOrCompute(inputs("new"), artifact(new AtomicInteger(), 100));
    clock.advance(Duration.ofHours(5));

    CleanupReport report = cache.cleanup();

    assertThat(report.removedEntries()).isEqualTo(1);
    assertThat(report.freedBytes()).isEqualTo(100);
    assertThat(report.remainingBytes()).isEqualTo(100);
    assertThat(objectStore.exists(old.entry().payloadRef())).isFalse();
  }

  @Test
  void cleanup_usesShorterAgeWhenOverSizeLimit() {
    cache.getOrCompute(inputs("a"), artifact(new AtomicInteger(), 600));
    cache.getOrCompute(inputs("b"), artifact(new AtomicInteger(), 600));
    clock.advance(Duration.ofHours(13));

    CleanupReport report = cache.cleanup();

    assertThat(report.removedEntries()).isEqualTo(2);
    assertThat(report.remainingBytes()).isZero();
  }

  @Test
  void cleanup_keepsFreshEntriesWhenUnderSizeLimit() {
    cache.getOrCompute(inputs("a"), artifact(new AtomicInteger(), 100));
    clock.advance(Duration.ofHours(13));

    assertThat(cache.cleanup().removedEntries()).isZero();
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  private static FingerprintInputs inputs(String text) {
    return FingerprintInputs.of("tts", Map.of("text", text, "voice", "Fritz-PlayAI"));
  }

  private static Supplier<ComputedArtifact> artifact(
      AtomicInteger counter, int size) {
    return () -> {
      counter.incrementAndGet();
      return new ComputedArtifact(new byte[size], "audio/wav", 1.0);
    };
  }
}
