package com.ospicorp.anomalyapi.detection;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.config.Precision;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalyapi.error.InsufficientDataException;
import com.ospicorp.anomalyapi.error.ModelNotFittedException;
import com.ospicorp.anomalyapi.error.ModelStateCorruptException;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Scores values with a one-dimensional Random Cut Forest trained on the batch. A value is
 * anomalous when its RCF anomaly score exceeds the configured threshold. Scoring never updates
 * the forest.
 */
public class RandomCutForestStrategy implements DetectionStrategy {
  public static final String TYPE = "rcf";

  private static final ObjectMapper JSON = new ObjectMapper();

  private final Settings settings;
  private volatile Fitted fitted;

  public RandomCutForestStrategy(Settings settings) {
    if (settings.numberOfTrees() < 1) {
      throw new IllegalArgumentException("numberOfTrees must be at least 1");
    }
    if (settings.sampleSize() < 2) {
      throw new IllegalArgumentException("sampleSize must be at least 2");
    }
    if (settings.minSamples() < 1 || settings.minSamples() > settings.sampleSize()) {
      throw new IllegalArgumentException("minSamples must be between 1 and sampleSize");
    }
    this.settings = settings;
  }

  @Override
  public String modelType() {
    return TYPE;
  }

  @Override
  public int minSamples() {
    return settings.minSamples();
  }

  @Override
  public boolean isFitted() {
    return fitted != null;
  }

  @Override
  public void fit(double[] values) {
    if (values.length < settings.minSamples()) {
      throw new InsufficientDataException(TYPE, settings.minSamples(), values.length);
    }
    RandomCutForest.Builder<?> builder = RandomCutForest.builder()
        .dimensions(1)
        .precision(Precision.FLOAT_32)
        .numberOfTrees(settings.numberOfTrees())
        .sampleSize(settings.sampleSize())
        .outputAfter(Math.min(values.length, settings.sampleSize()));
    if (settings.seed() != null) {
      builder.randomSeed(settings.seed());
    }
    RandomCutForest forest = builder.build();
    for (double value : values) {
      forest.update(new double[] {value});
    }
    fitted = new Fitted(forest, settings.scoreThreshold());
  }

  @Override
  public Classification classify(double value) {
    Fitted current = requireFitted();
    double score = current.forest().getAnomalyScore(new double[] {value});
    return new Classification(score > current.scoreThreshold(), score);
  }

  @Override
  public byte[] serialize() {
    Fitted current = requireFitted();
    try {
      return JSON.writeValueAsBytes(
          new PersistedForest(current.scoreThreshold(), mapper().toState(current.forest())));
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not serialize random cut forest", ex);
    }
  }

  @Override
  public void deserialize(byte[] bytes) {
    PersistedForest persisted;
    try {
      persisted = JSON.readValue(bytes, PersistedForest.class);
    } catch (IOException ex) {
      throw new ModelStateCorruptException("Unreadable random cut forest state", ex);
    }
    if (persisted.forest() == null) {
      throw new ModelStateCorruptException("Random cut forest state has no forest", null);
    }
    try {
      fitted = new Fitted(mapper().toModel(persisted.forest()), persisted.scoreThreshold());
    } catch (RuntimeException ex) {
      throw new ModelStateCorruptException("Random cut forest state cannot be restored", ex);
    }
  }

  private Fitted requireFitted() {
    Fitted current = fitted;
    if (current == null) {
      throw new ModelNotFittedException(TYPE);
    }
    return current;
  }

  private static RandomCutForestMapper mapper() {
    RandomCutForestMapper mapper = new RandomCutForestMapper();
    mapper.setSaveExecutorContextEnabled(true);
    // restore the fitted cuts instead of re-growing trees from the samples
    mapper.setSaveTreeStateEnabled(true);
    return mapper;
  }

  public record Settings(int numberOfTrees, int sampleSize, Long seed, double scoreThreshold,
      int minSamples) {
    public static Settings defaults() {
      return new Settings(RandomCutForest.DEFAULT_NUMBER_OF_TREES,
          RandomCutForest.DEFAULT_SAMPLE_SIZE, null, 1.5, 8);
    }
  }

  private record Fitted(RandomCutForest forest, double scoreThreshold) {}

  record PersistedForest(double scoreThreshold, RandomCutForestState forest) {}
}
