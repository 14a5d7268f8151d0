package com.ospicorp.anomalyapi.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class AnomalyMetrics {
  private static final double P95 = 0.95;

  private final MeterRegistry registry;
  private final Timer fitLatency;
  private final Timer predictLatency;
  private final Counter anomalousPredictions;
  private final Counter storageRetries;
  private final Counter cacheHits;
  private final Counter cacheMisses;

  public AnomalyMetrics(MeterRegistry registry) {
    this.registry = registry;
    this.fitLatency = Timer.builder("anomaly.fit.latency")
        .description("Time to fit and persist a model")
        .publishPercentiles(P95)
        .register(registry);
    this.predictLatency = Timer.builder("anomaly.predict.latency")
        .description("Time to classify one value")
        .publishPercentiles(P95)
        .register(registry);
    this.anomalousPredictions = registry.counter("anomaly.predictions.anomalous");
    this.storageRetries = registry.counter("anomaly.store.retries");
    this.cacheHits = registry.counter("anomaly.cache.hits");
    this.cacheMisses = registry.counter("anomaly.cache.misses");
  }

  public Timer.Sample start() {
    return Timer.start(registry);
  }

  public void recordFit(Timer.Sample sample, String outcome) {
    sample.stop(fitLatency);
    registry.counter("anomaly.fit.requests", "outcome", outcome).increment();
  }

  public void recordPredict(Timer.Sample sample, String outcome, boolean anomaly) {
    sample.stop(predictLatency);
    registry.counter("anomaly.predict.requests", "outcome", outcome).increment();
    if (anomaly) {
      anomalousPredictions.increment();
    }
  }

  public void recordError(String operation, Exception error) {
    registry.counter("anomaly.errors",
        "operation", operation,
        "type", error.getClass().getSimpleName()).increment();
  }

  public void storageRetry() {
    storageRetries.increment();
  }

  public void cacheHit() {
    cacheHits.increment();
  }

  public void cacheMiss() {
    cacheMisses.increment();
  }

  public Snapshot snapshot() {
    return new Snapshot(summarize(fitLatency), summarize(predictLatency));
  }

  private static LatencySummary summarize(Timer timer) {
    long count = timer.count();
    if (count == 0) {
      return new LatencySummary(0, null, null);
    }
    Double p95 = null;
    for (ValueAtPercentile value : timer.takeSnapshot().percentileValues()) {
      if (value.percentile() == P95) {
        p95 = value.value(TimeUnit.MILLISECONDS);
      }
    }
    return new LatencySummary(count, timer.mean(TimeUnit.MILLISECONDS), p95);
  }

  public record LatencySummary(
      @JsonProperty("count") long count,
      @JsonProperty("avg_latency_ms") Double avgLatencyMs,
      @JsonProperty("p95_latency_ms") Double p95LatencyMs
  ) {}

  public record Snapshot(
      @JsonProperty("training") LatencySummary training,
      @JsonProperty("inference") LatencySummary inference
  ) {}
}
