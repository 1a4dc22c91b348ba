package com.scholary.transcriber.api;

import com.scholary.transcriber.session.StorageStatistics;
import com.scholary.transcriber.session.StorageStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for storage usage. */
@RestController
@Tag(name = "Storage", description = "Storage usage")
public class StorageController {

  private final StorageStatisticsService statisticsService;

  public StorageController(StorageStatisticsService statisticsService) {
    this.statisticsService = statisticsService;
  }

  @GetMapping("/api/v1/storage/stats")
  @Operation(
      summary = "Storage statistics",
      description = "Session counts by status, stored audio size and cache usage")
  public ResponseEntity<StorageStatistics> getStatistics() {
    return ResponseEntity.ok(statisticsService.collect());
  }
}
