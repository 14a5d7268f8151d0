package com.ospicorp.anomalyapi.error;

import java.time.Duration;

public class OperationTimeoutException extends AnomalyDetectionException {
  public OperationTimeoutException(String operation, Duration timeout) {
    super(ErrorKind.TIMEOUT, operation + " did not complete within " + timeout.toMillis() + " ms");
  }
}
