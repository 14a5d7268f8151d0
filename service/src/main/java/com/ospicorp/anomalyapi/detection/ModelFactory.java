package com.ospicorp.anomalyapi.detection;

import com.ospicorp.anomalyapi.error.UnknownModelTypeException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/** Builds a fresh, unfitted strategy for a model type name. Holds configuration only. */
public class ModelFactory {
  private final Map<String, Supplier<DetectionStrategy>> registry;

  public ModelFactory(StatisticalStrategy.Settings statistical,
      RandomCutForestStrategy.Settings forest) {
    this.registry = Map.of(
        StatisticalStrategy.TYPE, () -> new StatisticalStrategy(statistical),
        RandomCutForestStrategy.TYPE, () -> new RandomCutForestStrategy(forest));
  }

  public static ModelFactory withDefaults() {
    return new ModelFactory(StatisticalStrategy.Settings.defaults(),
        RandomCutForestStrategy.Settings.defaults());
  }

  public DetectionStrategy create(String modelType) {
    if (modelType == null) {
      throw new UnknownModelTypeException(null);
    }
    Supplier<DetectionStrategy> supplier = registry.get(modelType.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new UnknownModelTypeException(modelType);
    }
    return supplier.get();
  }

  public Set<String> supportedTypes() {
    return new TreeSet<>(registry.keySet());
  }
}
