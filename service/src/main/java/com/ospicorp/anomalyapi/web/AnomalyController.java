package com.ospicorp.anomalyapi.web;

import com.ospicorp.anomalyapi.service.AnomalyService;
import com.ospicorp.anomalyapi.service.FitResult;
import com.ospicorp.anomalyapi.service.Prediction;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/series")
@Tag(name = "Series models")
public class AnomalyController {
  private final AnomalyService anomalyService;

  public AnomalyController(AnomalyService anomalyService) {
    this.anomalyService = anomalyService;
  }

  @PostMapping("/{seriesId}/fit")
  @Operation(summary = "Fit a new model version for the series")
  public ResponseEntity<FitResult> fit(@PathVariable String seriesId,
      @Valid @RequestBody FitRequest request) {
    FitResult result = anomalyService.fit(seriesId, request.values());
    return ResponseEntity.status(HttpStatus.CREATED).body(result);
  }

  @PostMapping("/{seriesId}/predict")
  @Operation(summary = "Classify a value against the latest (or a pinned) model version")
  public Prediction predict(@PathVariable String seriesId,
      @Valid @RequestBody PredictRequest request) {
    return anomalyService.predict(seriesId, request.value(), request.version());
  }

  @GetMapping("/{seriesId}/versions")
  @Operation(summary = "List stored model versions, oldest first")
  public VersionsResponse versions(@PathVariable String seriesId) {
    return VersionsResponse.of(seriesId, anomalyService.listVersions(seriesId));
  }

  @GetMapping
  @Operation(summary = "Count series with at least one stored model")
  public Map<String, Object> series() {
    return Map.of("trained_series", anomalyService.trainedSeriesCount());
  }
}
