package com.ospicorp.anomalyapi.error;

public class InvalidSeriesIdException extends InvalidInputException {
  public InvalidSeriesIdException(String seriesId) {
    super("series_id", "'" + seriesId + "' must match [A-Za-z0-9_.-]{1,128}");
  }
}
