package com.scholary.transcriber.session;

import com.scholary.transcriber.cache.CacheInfo;
import com.scholary.transcriber.cache.ContentAddressedCache;
import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Aggregates storage usage from the session and chunk repositories and the cache index. */
@Service
public class StorageStatisticsService {

  private final SessionRepository sessionRepository;
  private final ChunkRepository chunkRepository;
  private final ContentAddressedCache cache;

  public StorageStatisticsService(
      SessionRepository sessionRepository,
      ChunkRepository chunkRepository,
      ContentAddressedCache cache) {
    this.sessionRepository = sessionRepository;
    this.chunkRepository = chunkRepository;
    this.cache = cache;
  }

  public StorageStatistics collect() {
    List<Session> sessions = sessionRepository.findAll();
    Map<SessionStatus, Integer> byStatus = new EnumMap<>(SessionStatus.class);
    for (SessionStatus status : SessionStatus.values()) {
      byStatus.put(status, 0);
    }
    int active = 0;
    for (Session session : sessions) {
      byStatus.merge(session.status(), 1, Integer::sum);
      if (!session.status().isTerminal()) {
        active++;
      }
    }

    List<Chunk> chunks = chunkRepository.findAll();
    long storedBytes = 0;
    int stored = 0;
    for (Chunk chunk : chunks) {
      if (chunk.isUploaded()) {
        storedBytes += chunk.sizeBytes();
        stored++;
      }
    }
    double average = stored == 0 ? 0.0 : (double) storedBytes / stored;

    CacheInfo cacheInfo = cache.info();
    return new StorageStatistics(
        sessions.size(),
        active,
        byStatus,
        chunks.size(),
        storedBytes,
        average,
        cacheInfo.entries(),
        cacheInfo.totalBytes());
  }
}
