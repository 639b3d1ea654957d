package com.verlumen.forecastbench.evaluation;

final class MeanAbsoluteError implements MetricCalculator {
  @Override
  public Metric metric() {
    return Metric.MAE;
  }

  @Override
  public MetricValue calculate(double[] predicted, double[] actual) {
    double sum = 0.0;
    for (int i = 0; i < predicted.length; i++) {
      sum += Math.abs(predicted[i] - actual[i]);
    }
    return MetricValue.orUndefined(sum / predicted.length);
  }
}
