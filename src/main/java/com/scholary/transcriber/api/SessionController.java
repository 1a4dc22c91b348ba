package com.scholary.transcriber.api;

import com.scholary.transcriber.chunk.ChunkStore;
import com.scholary.transcriber.chunk.ChunkValidator;
import com.scholary.transcriber.chunk.GapDetector;
import com.scholary.transcriber.chunk.SessionSummary;
import com.scholary.transcriber.session.SessionLifecycleService;
import com.scholary.transcriber.session.SessionRetentionService;
import com.scholary.transcriber.session.SessionRetentionService.SessionDeletion;
import com.scholary.transcriber.transcript.AggregatedTranscript;
import com.scholary.transcriber.transcript.TranscriptAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for session state, gaps and transcripts. */
@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Sessions", description = "Session progress and aggregated transcripts")
public class SessionController {

  private final ChunkStore chunkStore;
  private final ChunkValidator validator;
  private final GapDetector gapDetector;
  private final TranscriptAggregator aggregator;
  private final SessionLifecycleService lifecycle;
  private final SessionRetentionService retention;

  public SessionController(
      ChunkStore chunkStore,
      ChunkValidator validator,
      GapDetector gapDetector,
      TranscriptAggregator aggregator,
      SessionLifecycleService lifecycle,
      SessionRetentionService retention) {
    this.chunkStore = chunkStore;
    this.validator = validator;
    this.gapDetector = gapDetector;
    this.aggregator = aggregator;
    this.lifecycle = lifecycle;
    this.retention = retention;
  }

  @GetMapping("/{sessionId}")
  @Operation(summary = "Get session summary", description = "Session status and per-chunk progress")
  public ResponseEntity<SessionSummary> getSession(@PathVariable String sessionId) {
    return ResponseEntity.ok(chunkStore.getSessionSummary(sessionId));
  }

  @GetMapping("/{sessionId}/transcript")
  @Operation(
      summary = "Get aggregated transcript",
      description =
          "Merge the transcripts of all chunks stored so far. May be called while chunks are still"
              + " arriving.")
  public ResponseEntity<AggregatedTranscript> getTranscript(@PathVariable String sessionId) {
    validator.validateSessionId(sessionId);
    return ResponseEntity.ok(aggregator.aggregate(sessionId));
  }

  @GetMapping("/{sessionId}/gaps")
  @Operation(summary = "Find missing chunks", description = "Sequence indices missing so far")
  public ResponseEntity<GapsResponse> getGaps(@PathVariable String sessionId) {
    validator.validateSessionId(sessionId);
    List<Integer> gaps = gapDetector.findGaps(sessionId);
    return ResponseEntity.ok(new GapsResponse(sessionId, gaps, !gaps.isEmpty()));
  }

  @PostMapping("/{sessionId}/complete")
  @Operation(
      summary = "Finalize session",
      description = "Aggregate now and close the session without waiting for pending chunks")
  public ResponseEntity<AggregatedTranscript> completeSession(@PathVariable String sessionId) {
    return ResponseEntity.ok(lifecycle.finalizeSession(sessionId));
  }

  @DeleteMapping("/{sessionId}")
  @Operation(
      summary = "Delete session",
      description = "Remove the session with all chunk rows and stored audio, whatever its status")
  public ResponseEntity<SessionDeletion> deleteSession(@PathVariable String sessionId) {
    validator.validateSessionId(sessionId);
    return ResponseEntity.ok(retention.deleteSession(sessionId));
  }
}
