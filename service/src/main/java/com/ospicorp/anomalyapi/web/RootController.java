package com.ospicorp.anomalyapi.web;

import com.ospicorp.anomalyapi.metrics.AnomalyMetrics;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final AnomalyMetrics metrics;

  public RootController(AnomalyMetrics metrics) {
    this.metrics = metrics;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("service", "anomaly-api", "status", "ok");
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }

  @GetMapping("/v1/metrics")
  public AnomalyMetrics.Snapshot metrics() {
    return metrics.snapshot();
  }
}
