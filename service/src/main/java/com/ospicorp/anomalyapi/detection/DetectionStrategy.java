package com.ospicorp.anomalyapi.detection;

/**
 * A pluggable anomaly-detection algorithm. Implementations do no I/O: the model store hands
 * them samples and persists whatever {@link #serialize()} returns.
 *
 * <p>After {@link #fit(double[])} or {@link #deserialize(byte[])} returns, a strategy is only
 * read, so {@link #classify(double)} may be called from several threads at once.
 */
public interface DetectionStrategy {

  String modelType();

  /** Smallest batch {@link #fit(double[])} accepts. */
  int minSamples();

  boolean isFitted();

  /**
   * @throws com.ospicorp.anomalyapi.error.InsufficientDataException if the batch is shorter
   *     than {@link #minSamples()}
   */
  void fit(double[] values);

  /**
   * @throws com.ospicorp.anomalyapi.error.ModelNotFittedException if neither fitted nor loaded
   */
  Classification classify(double value);

  byte[] serialize();

  /**
   * @throws com.ospicorp.anomalyapi.error.ModelStateCorruptException if the bytes were not
   *     produced by this model type
   */
  void deserialize(byte[] state);
}
