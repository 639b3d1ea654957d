package com.verlumen.forecastbench.models.baseline;

import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.windowing.Window;
import java.util.Arrays;

/** Predicts that every future step equals the arithmetic mean of the window. */
final class MovingAverageModel extends BaselineModel {
  static final String NAME = "MOVING_AVERAGE";

  MovingAverageModel(ModelConfig config) {
    super(config);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  double level(Window window, int node) {
    // Summing in sorted order makes the mean bit-identical for any ordering of the window.
    double[] values = window.column(node);
    Arrays.sort(values);
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }
}
