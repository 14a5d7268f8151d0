package com.ospicorp.anomalyapi.error;

/** A specific model version is absent from storage. */
public class ModelNotFoundException extends AnomalyDetectionException {
  public ModelNotFoundException(String seriesId, int version) {
    super(ErrorKind.NOT_FOUND,
        "Model for series '" + seriesId + "' version " + version + " not found");
  }
}
