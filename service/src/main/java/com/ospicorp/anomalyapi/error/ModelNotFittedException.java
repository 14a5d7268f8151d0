package com.ospicorp.anomalyapi.error;

public class ModelNotFittedException extends AnomalyDetectionException {
  public ModelNotFittedException(String modelType) {
    super(ErrorKind.INTERNAL, "Model '" + modelType + "' must be fitted before it can be used");
  }
}
