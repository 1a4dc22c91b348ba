package com.scholary.transcriber.api;

import com.scholary.transcriber.cache.CacheInfo;
import com.scholary.transcriber.cache.CachedArtifact;
import com.scholary.transcriber.cache.CleanupReport;
import com.scholary.transcriber.cache.ContentAddressedCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Serves cached artifacts, reports cache usage and triggers cleanup. */
@RestController
@Tag(name = "Cache", description = "Content-addressed artifact cache")
public class CacheController {

  private final ContentAddressedCache cache;

  public CacheController(ContentAddressedCache cache) {
    this.cache = cache;
  }

  @GetMapping("/api/v1/cache/info")
  @Operation(summary = "Cache statistics", description = "Entry count, size and hits")
  public ResponseEntity<CacheInfo> info() {
    return ResponseEntity.ok(cache.info());
  }

  @GetMapping("/api/v1/cache/{key}")
  @Operation(summary = "Fetch cached artifact", description = "Raw bytes with their content type")
  public ResponseEntity<byte[]> getArtifact(@PathVariable String key) {
    CachedArtifact artifact = cache.read(key);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(artifact.entry().contentType()))
        .contentLength(artifact.data().length)
        .cacheControl(CacheControl.empty().noTransform().cachePublic())
        .body(artifact.data());
  }

  @PostMapping("/api/v1/cache/cleanup")
  @Operation(summary = "Run cache cleanup", description = "Remove expired cache entries now")
  public ResponseEntity<CleanupReport> cleanup() {
    return ResponseEntity.ok(cache.cleanup());
  }
}
