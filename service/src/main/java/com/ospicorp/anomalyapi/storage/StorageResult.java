package com.ospicorp.anomalyapi.storage;

import com.ospicorp.anomalyapi.error.AnomalyDetectionException;
import java.util.Objects;

/**
 * Outcome of a storage call. Transient failures are worth retrying, permanent ones are not;
 * callers branch on {@link #status()} instead of catching exceptions.
 */
public record StorageResult<T>(Status status, T value, AnomalyDetectionException error) {

  public enum Status {
    OK,
    NOT_FOUND,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE
  }

  public StorageResult {
    Objects.requireNonNull(status, "status");
    if (status != Status.OK && error == null) {
      throw new IllegalArgumentException(status + " result needs an error");
    }
  }

  public static <T> StorageResult<T> ok(T value) {
    return new StorageResult<>(Status.OK, value, null);
  }

  public static StorageResult<Void> ok() {
    return new StorageResult<>(Status.OK, null, null);
  }

  public static <T> StorageResult<T> notFound(AnomalyDetectionException error) {
    return new StorageResult<>(Status.NOT_FOUND, null, error);
  }

  public static <T> StorageResult<T> transientFailure(AnomalyDetectionException error) {
    return new StorageResult<>(Status.TRANSIENT_FAILURE, null, error);
  }

  public static <T> StorageResult<T> permanentFailure(AnomalyDetectionException error) {
    return new StorageResult<>(Status.PERMANENT_FAILURE, null, error);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public boolean isNotFound() {
    return status == Status.NOT_FOUND;
  }

  public boolean isTransientFailure() {
    return status == Status.TRANSIENT_FAILURE;
  }

  /** The value of a successful call; otherwise throws the carried error. */
  public T orElseThrow() {
    if (status == Status.OK) {
      return value;
    }
    throw error;
  }
}
