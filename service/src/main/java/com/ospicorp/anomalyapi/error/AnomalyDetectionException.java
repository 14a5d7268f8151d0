package com.ospicorp.anomalyapi.error;

/**
 * Base class of every failure the anomaly service reports. The facade annotates instances with
 * the operation and series they failed in before surfacing them unchanged.
 */
public abstract class AnomalyDetectionException extends RuntimeException {
  private final ErrorKind kind;
  private volatile String operation;
  private volatile String seriesId;

  protected AnomalyDetectionException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected AnomalyDetectionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public String operation() {
    return operation;
  }

  public String seriesId() {
    return seriesId;
  }

  public AnomalyDetectionException annotate(String operation, String seriesId) {
    if (this.operation == null) {
      this.operation = operation;
    }
    if (this.seriesId == null) {
      this.seriesId = seriesId;
    }
    return this;
  }
}
