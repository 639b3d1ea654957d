package com.verlumen.forecastbench.models;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Shape and trainer settings a model is created with. */
@AutoValue
public abstract class ModelConfig {
  public static ModelConfig create(int windowSize, int horizon, TrainingConfig training) {
    checkArgument(windowSize > 0, "window_size must be positive: %s", windowSize);
    checkArgument(horizon > 0, "horizon must be positive: %s", horizon);
    return new AutoValue_ModelConfig(windowSize, horizon, training);
  }

  public abstract int windowSize();

  public abstract int horizon();

  public abstract TrainingConfig training();
}
