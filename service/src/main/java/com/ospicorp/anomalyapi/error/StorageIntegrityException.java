package com.ospicorp.anomalyapi.error;

/** Storage holds duplicate, overlapping or mismatching versions for a series. */
public class StorageIntegrityException extends AnomalyDetectionException {
  public StorageIntegrityException(String message) {
    super(ErrorKind.INTERNAL, message);
  }

  public StorageIntegrityException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
