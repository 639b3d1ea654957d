package com.verlumen.forecastbench.evaluation;

import com.google.common.collect.ImmutableList;

/** Every available metric calculator, in {@link Metric} order. */
final class MetricCalculators {
  static final ImmutableList<MetricCalculator> ALL_CALCULATORS =
      ImmutableList.of(
          new MeanAbsoluteError(), new RootMeanSquaredError(), new MeanAbsolutePercentageError());

  private MetricCalculators() {}
}
