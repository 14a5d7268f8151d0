package com.ospicorp.anomalyapi.error;

public class InsufficientDataException extends AnomalyDetectionException {
  private final int required;
  private final int actual;

  public InsufficientDataException(String modelType, int required, int actual) {
    super(ErrorKind.INVALID_INPUT, "Model '" + modelType + "' requires at least " + required
        + " samples, got " + actual);
    this.required = required;
    this.actual = actual;
  }

  public int required() {
    return required;
  }

  public int actual() {
    return actual;
  }
}
