package com.ospicorp.anomalyapi.detection;

/** Outcome of classifying one value; {@code score} is null when the model cannot grade it. */
public record Classification(boolean anomaly, Double score) {}
