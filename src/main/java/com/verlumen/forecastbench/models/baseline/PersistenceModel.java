package com.verlumen.forecastbench.models.baseline;

import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.windowing.Window;

/** Predicts that every future step equals the last observed value. */
final class PersistenceModel extends BaselineModel {
  static final String NAME = "PERSISTENCE";

  PersistenceModel(ModelConfig config) {
    super(config);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  double level(Window window, int node) {
    return window.last(node);
  }
}
