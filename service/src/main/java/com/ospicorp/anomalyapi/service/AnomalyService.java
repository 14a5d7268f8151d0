package com.ospicorp.anomalyapi.service;

import com.ospicorp.anomalyapi.detection.Classification;
import com.ospicorp.anomalyapi.error.AnomalyDetectionException;
import com.ospicorp.anomalyapi.error.InvalidInputException;
import com.ospicorp.anomalyapi.error.InvalidSeriesIdException;
import com.ospicorp.anomalyapi.error.OperationAbortedException;
import com.ospicorp.anomalyapi.error.OperationTimeoutException;
import com.ospicorp.anomalyapi.error.SeriesNotFoundException;
import com.ospicorp.anomalyapi.metrics.AnomalyMetrics;
import com.ospicorp.anomalyapi.store.LoadedModel;
import com.ospicorp.anomalyapi.store.ModelRecord;
import com.ospicorp.anomalyapi.store.ModelStore;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for fit and predict calls. Each call runs on the worker pool and is bounded by the
 * request timeout; a timed-out call is interrupted so that the model store aborts its pending
 * storage I/O and releases the series lock without committing a version.
 */
@Service
public class AnomalyService {

  public static final String FIT = "fit";
  public static final String PREDICT = "predict";
  public static final String LIST_VERSIONS = "list_versions";
  public static final String INVALIDATE = "invalidate";

  private static final Logger log = LoggerFactory.getLogger(AnomalyService.class);

  private static final Pattern SERIES_ID = Pattern.compile("^[A-Za-z0-9_.-]{1,128}$");

  private final ModelStore store;
  private final AnomalyMetrics metrics;
  private final AsyncTaskExecutor workers;
  private final Duration requestTimeout;

  public AnomalyService(ModelStore store, AnomalyMetrics metrics,
      @Qualifier("anomalyWorkerPool") AsyncTaskExecutor workers,
      @Value("${anomaly.service.request-timeout-ms:30000}") long requestTimeoutMs) {
    this.store = store;
    this.metrics = metrics;
    this.workers = workers;
    this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
  }

  public FitResult fit(String seriesId, List<Double> values) {
    Timer.Sample sample = metrics.start();
    String outcome = "error";
    try {
      validateSeriesId(seriesId);
      double[] batch = toBatch(values);
      ModelRecord record = execute(FIT, () -> store.fit(seriesId, batch));
      outcome = "success";
      return new FitResult(seriesId, record.version(), record.modelType(), record.sampleCount());
    } catch (AnomalyDetectionException ex) {
      throw fail(FIT, seriesId, ex);
    } finally {
      metrics.recordFit(sample, outcome);
    }
  }

  public Prediction predict(String seriesId, double value) {
    return predict(seriesId, value, null);
  }

  /**
   * Classifies {@code value} with the newest model of the series, or with {@code version} when
   * one is given.
   */
  public Prediction predict(String seriesId, double value, Integer version) {
    Timer.Sample sample = metrics.start();
    String outcome = "error";
    boolean anomaly = false;
    try {
      validateSeriesId(seriesId);
      if (!Double.isFinite(value)) {
        throw new InvalidInputException("value", "must be a finite number");
      }
      LoadedModel model = execute(PREDICT, () -> version == null
          ? store.getForPredict(seriesId)
          : store.load(seriesId, version));
      Classification result = model.classify(value);
      anomaly = result.anomaly();
      outcome = "success";
      return new Prediction(seriesId, result.anomaly(), result.score(), model.version());
    } catch (AnomalyDetectionException ex) {
      throw fail(PREDICT, seriesId, ex);
    } finally {
      metrics.recordPredict(sample, outcome, anomaly);
    }
  }

  public List<Integer> listVersions(String seriesId) {
    try {
      validateSeriesId(seriesId);
      List<Integer> versions = execute(LIST_VERSIONS, () -> store.listVersions(seriesId));
      if (versions.isEmpty()) {
        throw new SeriesNotFoundException(seriesId);
      }
      return versions;
    } catch (AnomalyDetectionException ex) {
      throw fail(LIST_VERSIONS, seriesId, ex);
    }
  }

  public int trainedSeriesCount() {
    try {
      return execute("list_series", store::listSeries).size();
    } catch (AnomalyDetectionException ex) {
      throw fail("list_series", null, ex);
    }
  }

  public void invalidate(String seriesId) {
    try {
      validateSeriesId(seriesId);
      store.invalidate(seriesId);
    } catch (AnomalyDetectionException ex) {
      throw fail(INVALIDATE, seriesId, ex);
    }
  }

  private <T> T execute(String operation, Callable<T> task) {
    Future<T> future;
    try {
      future = workers.submit(task);
    } catch (TaskRejectedException ex) {
      throw new OperationAbortedException("No worker available for " + operation, ex);
    }
    try {
      return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new OperationTimeoutException(operation, requestTimeout);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new OperationAbortedException(operation + " interrupted", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(operation + " failed", cause);
    }
  }

  private AnomalyDetectionException fail(String operation, String seriesId,
      AnomalyDetectionException ex) {
    metrics.recordError(operation, ex);
    log.debug("{} failed for series_id='{}': {}", operation, seriesId, ex.getMessage());
    return ex.annotate(operation, seriesId);
  }

  private static void validateSeriesId(String seriesId) {
    if (seriesId == null || !SERIES_ID.matcher(seriesId).matches()
        || ".".equals(seriesId) || "..".equals(seriesId)) {
      throw new InvalidSeriesIdException(seriesId);
    }
  }

  private static double[] toBatch(List<Double> values) {
    if (values == null || values.isEmpty()) {
      throw new InvalidInputException("values", "at least one value is required");
    }
    double[] batch = new double[values.size()];
    for (int i = 0; i < batch.length; i++) {
      Double value = values.get(i);
      if (value == null || !Double.isFinite(value)) {
        throw new InvalidInputException("values", "element " + i + " is not a finite number");
      }
      batch[i] = value;
    }
    return batch;
  }
}
