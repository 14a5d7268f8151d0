package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.detection.Classification;
import com.ospicorp.anomalyapi.detection.DetectionStrategy;

/** Read-only handle on a fitted strategy at a known version. */
public final class LoadedModel {
  private final String seriesId;
  private final int version;
  private final DetectionStrategy strategy;

  LoadedModel(String seriesId, int version, DetectionStrategy strategy) {
    this.seriesId = seriesId;
    this.version = version;
    this.strategy = strategy;
  }

  public String seriesId() {
    return seriesId;
  }

  public int version() {
    return version;
  }

  public String modelType() {
    return strategy.modelType();
  }

  public Classification classify(double value) {
    return strategy.classify(value);
  }
}
