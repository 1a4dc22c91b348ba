package com.scholary.transcriber.api;

import com.scholary.transcriber.chunk.ChunkRef;
import com.scholary.transcriber.chunk.ChunkStore;
import com.scholary.transcriber.chunk.ChunkUpload;
import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.exception.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for chunk uploads.
 *
 * <p>Each chunk is stored and queued for transcription before the call returns; the transcript
 * itself is produced in the background.
 */
@RestController
@Tag(name = "Chunks", description = "Audio chunk upload")
public class ChunkController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkController.class);

  private final ChunkStore chunkStore;
  private final double defaultOverlapSeconds;

  public ChunkController(ChunkStore chunkStore, TranscriptionProperties properties) {
    this.chunkStore = chunkStore;
    this.defaultOverlapSeconds = properties.ingest().defaultOverlapSeconds();
  }

  @PostMapping(
      value = "/api/v1/sessions/{sessionId}/chunks",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a chunk",
      description =
          "Store one audio chunk of a session and queue it for transcription. Uploading the same"
              + " sequence index again replaces the earlier chunk.")
  public ResponseEntity<ChunkUploadResponse> uploadChunk(
      @PathVariable String sessionId,
      @RequestPart("file") MultipartFile file,
      @RequestParam int sequenceIndex,
      @RequestParam(required = false) Double overlapSeconds,
      @RequestParam(required = false) Integer totalChunks,
      @RequestParam(required = false) String questionId) {
    LOGGER.info(
        "Chunk upload: session={}, index={}, size={} bytes",
        sessionId,
        sequenceIndex,
        file.getSize());

    byte[] data;
    try {
      data = file.getBytes();
    } catch (IOException e) {
      throw new ValidationException("file", "Failed to read uploaded file: " + e.getMessage());
    }

    ChunkRef ref =
        chunkStore.upsertChunk(
            new ChunkUpload(
                sessionId,
                sequenceIndex,
                file.getOriginalFilename(),
                file.getContentType(),
                data,
                overlapSeconds != null ? overlapSeconds : defaultOverlapSeconds,
                totalChunks,
                questionId));

    return ResponseEntity.status(HttpStatus.CREATED).body(ChunkUploadResponse.from(ref));
  }
}
