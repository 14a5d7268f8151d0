package com.ospicorp.anomalyapi.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FitResult(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("version") int version,
    @JsonProperty("model_type") String modelType,
    @JsonProperty("points_used") int pointsUsed
) {}
