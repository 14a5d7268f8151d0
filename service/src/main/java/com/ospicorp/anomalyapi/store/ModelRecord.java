package com.ospicorp.anomalyapi.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** The persisted unit for one fitted version of a series. {@code state} is opaque. */
public record ModelRecord(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("version") int version,
    @JsonProperty("model_type") String modelType,
    @JsonProperty("state") byte[] state,
    @JsonProperty("fitted_at") Instant fittedAt,
    @JsonProperty("sample_count") int sampleCount
) {}
