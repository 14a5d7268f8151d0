package com.ospicorp.anomalyapi.web;

import com.ospicorp.anomalyapi.service.AnomalyService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {
  private final AnomalyService anomalyService;

  public AdminController(AnomalyService anomalyService) {
    this.anomalyService = anomalyService;
  }

  /** Drops the cached model; the next predict reloads the newest stored version. */
  @PostMapping("/series/{seriesId}/invalidate")
  public ResponseEntity<Map<String, String>> invalidate(@PathVariable String seriesId) {
    anomalyService.invalidate(seriesId);
    return ResponseEntity.accepted().body(Map.of("status", "invalidated", "series_id", seriesId));
  }
}
