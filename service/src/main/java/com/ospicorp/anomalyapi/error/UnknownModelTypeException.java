package com.ospicorp.anomalyapi.error;

public class UnknownModelTypeException extends AnomalyDetectionException {
  public UnknownModelTypeException(String modelType) {
    super(ErrorKind.INTERNAL, "Model type '" + modelType + "' is not supported");
  }
}
