package com.flamingo.dozor.api.rest;

import com.flamingo.dozor.config.DozorConfig;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final DozorConfig dozorConfig;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "dozor-batch");
    health.put("executable", dozorConfig.getExecutor().getExecutable());
    health.put("submit", dozorConfig.getExecutor().isSubmit());
    return ResponseEntity.ok(health);
  }
}
