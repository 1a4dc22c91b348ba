package com.scholary.transcriber.api;

import com.scholary.transcriber.tts.SpeechResult;
import com.scholary.transcriber.tts.SpeechService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Speech", description = "Cached text-to-speech")
public class SpeechController {

  private final SpeechService speechService;

  public SpeechController(SpeechService speechService) {
    this.speechService = speechService;
  }

  @PostMapping("/api/v1/tts")
  @Operation(
      summary = "Synthesize speech",
      description =
          "Render text as audio. Identical text, voice and format are served from the cache.")
  public ResponseEntity<SpeechResult> synthesize(@Valid @RequestBody SpeechRequest request) {
    return ResponseEntity.ok(
        speechService.synthesize(request.text(), request.voice(), request.format()));
  }
}
