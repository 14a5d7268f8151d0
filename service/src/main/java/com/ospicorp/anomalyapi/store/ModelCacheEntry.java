package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.detection.DetectionStrategy;

final class ModelCacheEntry {
  private final String seriesId;
  private final int version;
  private final DetectionStrategy strategy;
  private volatile long lastAccessed;

  ModelCacheEntry(String seriesId, int version, DetectionStrategy strategy, long now) {
    this.seriesId = seriesId;
    this.version = version;
    this.strategy = strategy;
    this.lastAccessed = now;
  }

  String seriesId() {
    return seriesId;
  }

  int version() {
    return version;
  }

  long lastAccessed() {
    return lastAccessed;
  }

  LoadedModel touch(long now) {
    lastAccessed = now;
    return new LoadedModel(seriesId, version, strategy);
  }

  /** The cache never moves a series back to an older version. */
  static ModelCacheEntry newer(ModelCacheEntry current, ModelCacheEntry candidate) {
    return candidate.version >= current.version ? candidate : current;
  }
}
