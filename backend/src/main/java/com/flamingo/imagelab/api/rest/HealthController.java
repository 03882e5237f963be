package com.flamingo.imagelab.api.rest;

import com.flamingo.imagelab.api.dto.response.SystemStats;
import com.flamingo.imagelab.service.health.HealthService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  @Value("${imagelab.version:0.1.0}")
  private String version;

  /** Returns the service banner. */
  @GetMapping("/")
  public ResponseEntity<Map<String, Object>> root() {
    Map<String, Object> body = new HashMap<>();
    body.put("status", "ok");
    body.put("version", version);
    return ResponseEntity.ok(body);
  }

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "imagelab");
    return ResponseEntity.ok(health);
  }

  /** Returns system statistics. */
  @GetMapping("/health/stats")
  public ResponseEntity<SystemStats> stats() {
    return ResponseEntity.ok(healthService.getSystemStats());
  }
}
