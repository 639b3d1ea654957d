package com.verlumen.forecastbench.evaluation;

/** Percentage error; undefined when any ground truth is zero. */
final class MeanAbsolutePercentageError implements MetricCalculator {
  @Override
  public Metric metric() {
    return Metric.MAPE;
  }

  @Override
  public MetricValue calculate(double[] predicted, double[] actual) {
    double sum = 0.0;
    for (int i = 0; i < predicted.length; i++) {
      if (actual[i] == 0.0) {
        return MetricValue.undefined();
      }
      sum += Math.abs((predicted[i] - actual[i]) / actual[i]);
    }
    return MetricValue.orUndefined(100.0 * sum / predicted.length);
  }
}
