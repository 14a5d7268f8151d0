package com.ospicorp.anomalyapi.error;

/**
 * A fitted model could not be committed. The previous version, if any, remains the last known
 * good state.
 */
public class FitPersistException extends AnomalyDetectionException {
  public FitPersistException(String seriesId, String reason, Throwable cause) {
    super(ErrorKind.STORAGE_UNAVAILABLE,
        "Could not persist model for series '" + seriesId + "': " + reason, cause);
  }
}
