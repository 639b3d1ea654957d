package com.verlumen.forecastbench.experiment.grid;

import com.google.auto.value.AutoValue;
import com.verlumen.forecastbench.experiment.ExperimentConfig;

/** One configuration of a grid, labelled {@code name=value,...}. */
@AutoValue
public abstract class GridPoint {
  static GridPoint create(String label, ExperimentConfig config) {
    return new AutoValue_GridPoint(label, config);
  }

  public abstract String label();

  public abstract ExperimentConfig config();
}
