package com.verlumen.forecastbench.evaluation;

final class RootMeanSquaredError implements MetricCalculator {
  @Override
  public Metric metric() {
    return Metric.RMSE;
  }

  @Override
  public MetricValue calculate(double[] predicted, double[] actual) {
    double sum = 0.0;
    for (int i = 0; i < predicted.length; i++) {
      double error = predicted[i] - actual[i];
      sum += error * error;
    }
    return MetricValue.orUndefined(Math.sqrt(sum / predicted.length));
  }
}
