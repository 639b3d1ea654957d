package com.verlumen.forecastbench.evaluation;

/** Computes one {@link Metric} over the predictions pooled at a single horizon step. */
interface MetricCalculator {
  Metric metric();

  /**
   * Computes the metric over aligned arrays of predicted and actual values.
   *
   * @param predicted predictions, in record order then node order
   * @param actual ground truth, aligned with {@code predicted}
   */
  MetricValue calculate(double[] predicted, double[] actual);
}
