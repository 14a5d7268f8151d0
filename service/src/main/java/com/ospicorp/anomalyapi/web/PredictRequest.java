package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** {@code version} pins the model used; the newest version is used when it is absent. */
public record PredictRequest(
    @JsonProperty("value") @NotNull Double value,
    @JsonProperty("version") @Min(1) Integer version
) {}
