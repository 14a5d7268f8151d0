package com.ospicorp.anomalyapi.error;

public class SeriesNotFoundException extends AnomalyDetectionException {
  public SeriesNotFoundException(String seriesId) {
    super(ErrorKind.NOT_FOUND, "No model found for series '" + seriesId + "'");
  }
}
