package com.ospicorp.anomalyapi.detection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalyapi.error.InsufficientDataException;
import com.ospicorp.anomalyapi.error.ModelNotFittedException;
import com.ospicorp.anomalyapi.error.ModelStateCorruptException;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Flags values further than {@code k} population standard deviations from the fitted mean.
 */
public class StatisticalStrategy implements DetectionStrategy {
  public static final String TYPE = "statistical";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final double EPSILON = 1e-9;

  private final double k;
  private final int minSamples;
  private volatile State state;

  public StatisticalStrategy(Settings settings) {
    if (settings.k() <= 0) {
      throw new IllegalArgumentException("k must be positive");
    }
    if (settings.minSamples() < 1) {
      throw new IllegalArgumentException("minSamples must be at least 1");
    }
    this.k = settings.k();
    this.minSamples = settings.minSamples();
  }

  @Override
  public String modelType() {
    return TYPE;
  }

  @Override
  public int minSamples() {
    return minSamples;
  }

  @Override
  public boolean isFitted() {
    return state != null;
  }

  @Override
  public void fit(double[] values) {
    if (values.length < minSamples) {
      throw new InsufficientDataException(TYPE, minSamples, values.length);
    }
    double[] moments = moments(values, 1.0);
    if (!Double.isFinite(moments[0]) || !Double.isFinite(moments[1])) {
      // the plain sums overflowed; redo them on values scaled into [-1, 1]
      double scale = 0;
      for (double value : values) {
        scale = Math.max(scale, Math.abs(value));
      }
      moments = moments(values, scale);
      moments[0] *= scale;
      moments[1] *= scale;
    }
    double mean = moments[0];
    double stddev = moments[1];
    state = new State(k, mean, stddev, values.length);
  }

  @Override
  public Classification classify(double value) {
    State current = requireFitted();
    double distance = Math.abs(value - current.mean());
    if (current.stddev() == 0) {
      return new Classification(distance > EPSILON, null);
    }
    if (Double.isInfinite(distance)) {
      double halfScore = Math.abs(value * 0.5 - current.mean() * 0.5) / current.stddev();
      return new Classification(halfScore > current.k() * 0.5,
          Math.min(halfScore * 2, Double.MAX_VALUE));
    }
    return new Classification(distance > current.k() * current.stddev(),
        Math.min(distance / current.stddev(), Double.MAX_VALUE));
  }

  @Override
  public byte[] serialize() {
    State current = requireFitted();
    try {
      return JSON.writeValueAsBytes(current);
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not serialize statistical model", ex);
    }
  }

  @Override
  public void deserialize(byte[] bytes) {
    State loaded;
    try {
      loaded = JSON.readValue(bytes, State.class);
    } catch (IOException ex) {
      throw new ModelStateCorruptException("Unreadable statistical model state", ex);
    }
    if (loaded.k() <= 0 || loaded.stddev() < 0
        || !Double.isFinite(loaded.mean()) || !Double.isFinite(loaded.stddev())) {
      throw new ModelStateCorruptException("Invalid statistical model state: " + loaded, null);
    }
    state = loaded;
  }

  public double mean() {
    return requireFitted().mean();
  }

  public double stddev() {
    return requireFitted().stddev();
  }

  private State requireFitted() {
    State current = state;
    if (current == null) {
      throw new ModelNotFittedException(TYPE);
    }
    return current;
  }

  /** Returns {@code {mean, population stddev}} of {@code values / scale}. */
  private static double[] moments(double[] values, double scale) {
    double sum = 0;
    for (double value : values) {
      sum += value / scale;
    }
    double mean = sum / values.length;
    double squares = 0;
    for (double value : values) {
      double delta = value / scale - mean;
      squares += delta * delta;
    }
    return new double[] {mean, Math.sqrt(squares / values.length)};
  }

  public record Settings(double k, int minSamples) {
    public static Settings defaults() {
      return new Settings(3.0, 2);
    }
  }

  // k travels with the state so a reloaded model grades exactly like the fitted one
  record State(double k, double mean, double stddev, int count) {}
}
