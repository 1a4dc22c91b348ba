package com.scholary.transcriber.transcript;

import com.scholary.transcriber.chunk.Chunk;
import com.scholary.transcriber.chunk.ChunkRepository;
import com.scholary.transcriber.chunk.ChunkSegment;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.AggregationProperties;
import com.scholary.transcriber.exception.NotFoundException;
import com.scholary.transcriber.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Merges the per-chunk transcripts of a session into one transcript.
 *
 * <p>Chunks are taken in sequence order. Each completed chunk's text is appended to the running
 * transcript after removing the words it repeats from the previous chunk (see {@link
 * OverlapMatcher}). The search window is derived from the chunk's overlap duration and a
 * words-per-second estimate.
 *
 * <p>Aggregation only reads the chunk store and may run while uploads are still arriving; it
 * reports whatever is stored at call time.
 */
@Service
public class TranscriptAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAggregator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ChunkRepository chunkRepository;
  private final AggregationProperties properties;

  public TranscriptAggregator(ChunkRepository chunkRepository, TranscriptionProperties properties) {
    this.chunkRepository = chunkRepository;
    this.properties = properties.aggregation();
  }

  /**
   * Aggregate the stored chunks of a session.
   *
   * @throws NotFoundException if the session has no chunks
   */
  public AggregatedTranscript aggregate(String sessionId) {
    List<Chunk> chunks = chunkRepository.findBySession(sessionId);
    if (chunks.isEmpty()) {
      throw new NotFoundException("No chunks stored for session: " + sessionId);
    }

    String transcript = "";
    Integer previousIndex = null;
    int completed = 0;
    double confidenceSum = 0.0;
    double duration = 0.0;
    List<MergedSegment> segments = new ArrayList<>();

    for (Chunk chunk : chunks) {
      if (!chunk.isCompleted()) {
        continue;
      }
      completed++;
      confidenceSum += chunk.confidenceScore() != null ? chunk.confidenceScore() : 0.0;
      duration += chunk.durationSeconds() != null ? chunk.durationSeconds() : 0.0;
      for (ChunkSegment segment : chunk.segments()) {
        segments.add(
            new MergedSegment(
                chunk.sequenceIndex(),
                segment.start(),
                segment.end(),
                segment.text(),
                segment.confidence()));
      }

      String text = chunk.transcriptText().strip();
      if (text.isEmpty()) {
        continue;
      }
      if (transcript.isEmpty()) {
        transcript = text;
      } else {
        int overlap =
            OverlapMatcher.findOverlap(
                transcript, text, windowFor(chunk.overlapSeconds()), properties.minMatchChars());
        STRUCTURED_LOGGER.logOverlapMerge(
            previousIndex, chunk.sequenceIndex(), chunk.overlapSeconds(), overlap > 0, overlap);
        transcript = OverlapMatcher.merge(transcript, text, overlap);
      }
      previousIndex = chunk.sequenceIndex();
    }

    double confidence = completed > 0 ? confidenceSum / completed : 0.0;
    LOGGER.debug(
        "Aggregated session {}: {}/{} chunks completed, {} chars",
        sessionId,
        completed,
        chunks.size(),
        transcript.length());

    return new AggregatedTranscript(
        sessionId, transcript, chunks.size(), completed, confidence, duration, segments);
  }

  /** Characters of the next transcript that may repeat the previous one. */
  int windowFor(double overlapSeconds) {
    long estimate =
        Math.round(overlapSeconds * properties.wordsPerSecond() * properties.charsPerWord());
    return (int) Math.min(properties.maxOverlapChars(), estimate);
  }
}
