package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record FitRequest(
    @JsonProperty("values") @NotEmpty List<Double> values
) {}
