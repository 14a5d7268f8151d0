package com.ospicorp.anomalyapi.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.anomalyapi.error.InsufficientDataException;
import com.ospicorp.anomalyapi.error.ModelNotFittedException;
import com.ospicorp.anomalyapi.error.ModelStateCorruptException;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RandomCutForestStrategyTest {

  private static final RandomCutForestStrategy.Settings SEEDED =
      new RandomCutForestStrategy.Settings(30, 128, 42L, 1.5, 8);

  private static double[] steadySignal(int size) {
    Random random = new Random(7);
    double[] values = new double[size];
    for (int i = 0; i < size; i++) {
      values[i] = 10.0 + random.nextGaussian() * 0.5;
    }
    return values;
  }

  @Test
  void farOutlierScoresAboveThreshold() {
    RandomCutForestStrategy strategy = new RandomCutForestStrategy(SEEDED);
    strategy.fit(steadySignal(400));

    Classification outlier = strategy.classify(500.0);
    Classification typical = strategy.classify(10.0);

    assertThat(outlier.anomaly()).isTrue();
    assertThat(outlier.score()).isGreaterThan(typical.score());
    assertThat(typical.anomaly()).isFalse();
  }

  @Test
  void scoringDoesNotChangeTheForest() {
    RandomCutForestStrategy strategy = new RandomCutForestStrategy(SEEDED);
    strategy.fit(steadySignal(200));

    double first = strategy.classify(12.0).score();
    for (int i = 0; i < 50; i++) {
      strategy.classify(12.0);
    }

    assertThat(strategy.classify(12.0).score()).isEqualTo(first);
  }

  @Test
  void reloadedForestScoresLikeTheOriginal() {
    RandomCutForestStrategy fitted = new RandomCutForestStrategy(SEEDED);
    fitted.fit(steadySignal(300));

    RandomCutForestStrategy restored =
        new RandomCutForestStrategy(RandomCutForestStrategy.Settings.defaults());
    restored.deserialize(fitted.serialize());

    for (double value : new double[] {9.5, 10.0, 11.2, 40.0, 500.0}) {
      Classification before = fitted.classify(value);
      Classification after = restored.classify(value);
      assertThat(after.anomaly()).isEqualTo(before.anomaly());
      assertThat(after.score()).isCloseTo(before.score(), within(1e-6));
    }
  }

  @Test
  void requiresMinimumSamples() {
    RandomCutForestStrategy strategy = new RandomCutForestStrategy(SEEDED);

    assertThatThrownBy(() -> strategy.fit(new double[] {1, 2, 3}))
        .isInstanceOf(InsufficientDataException.class);
    assertThatThrownBy(() -> strategy.classify(1.0)).isInstanceOf(ModelNotFittedException.class);
  }

  @Test
  void rejectsCorruptState() {
    RandomCutForestStrategy strategy = new RandomCutForestStrategy(SEEDED);

    assertThatThrownBy(() -> strategy.deserialize("[]".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(ModelStateCorruptException.class);
    assertThatThrownBy(() -> strategy.deserialize("{\"scoreThreshold\":1.5}"
        .getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(ModelStateCorruptException.class);
  }
}
