package com.ospicorp.anomalyapi.error;

public class StorageReadException extends AnomalyDetectionException {
  private final boolean transientFailure;

  public StorageReadException(String message, Throwable cause, boolean transientFailure) {
    super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
