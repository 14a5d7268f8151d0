package com.ospicorp.anomalyapi.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record Prediction(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("is_anomaly") boolean anomaly,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("score") Double score,
    @JsonProperty("version_used") int versionUsed
) {}
