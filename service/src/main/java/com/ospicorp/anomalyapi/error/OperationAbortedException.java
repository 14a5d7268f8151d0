package com.ospicorp.anomalyapi.error;

/** The worker running an operation was interrupted or could not be scheduled. */
public class OperationAbortedException extends AnomalyDetectionException {
  public OperationAbortedException(String message, Throwable cause) {
    super(ErrorKind.TIMEOUT, message, cause);
  }
}
