package com.scholary.transcriber.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Reports which sequence indices are missing between the lowest and highest stored chunk. */
@Component
public class GapDetector {

  private final ChunkRepository chunkRepository;

  public GapDetector(ChunkRepository chunkRepository) {
    this.chunkRepository = chunkRepository;
  }

  /**
   * Missing indices in ascending order.
   *
   * <p>Only chunks whose audio was stored count. A session without such chunks, known or not, has
   * no gaps.
   */
  public List<Integer> findGaps(String sessionId) {
    TreeSet<Integer> stored = new TreeSet<>();
    for (Chunk chunk : chunkRepository.findBySession(sessionId)) {
      if (chunk.isUploaded()) {
        stored.add(chunk.sequenceIndex());
      }
    }
    if (stored.isEmpty()) {
      return List.of();
    }
    List<Integer> gaps = new ArrayList<>();
    for (int index = stored.first(); index < stored.last(); index++) {
      if (!stored.contains(index)) {
        gaps.add(index);
      }
    }
    return gaps;
  }
}
