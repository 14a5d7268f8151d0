package com.ospicorp.anomalyapi.error;

public class InvalidInputException extends AnomalyDetectionException {
  private final String field;

  public InvalidInputException(String field, String message) {
    super(ErrorKind.INVALID_INPUT, "Validation error in '" + field + "': " + message);
    this.field = field;
  }

  public String field() {
    return field;
  }
}
