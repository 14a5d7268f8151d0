package com.ospicorp.anomalyapi.error;

public class ModelStateCorruptException extends AnomalyDetectionException {
  public ModelStateCorruptException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
