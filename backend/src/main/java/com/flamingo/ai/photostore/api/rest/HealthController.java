package com.flamingo.ai.photostore.api.rest;

import com.flamingo.ai.photostore.api.dto.response.StoreStatistics;
import com.flamingo.ai.photostore.schema.SchemaManager;
import com.flamingo.ai.photostore.service.store.PhotoMetadataStore;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and store statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final SchemaManager schemaManager;
  private final PhotoMetadataStore photoMetadataStore;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", schemaManager.isReady() ? "UP" : "DOWN");
    health.put("schemaReady", schemaManager.isReady());
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "photo-store");
    return ResponseEntity.ok(health);
  }

  /** Returns store statistics. */
  @GetMapping("/stats")
  public ResponseEntity<StoreStatistics> stats() {
    return ResponseEntity.ok(photoMetadataStore.getStatistics());
  }
}
