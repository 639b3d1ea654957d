package com.verlumen.forecastbench.experiment.grid;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricValue;

/**
 * Aggregate metrics of one grid configuration over its repeated runs. The standard deviation is
 * the sample one and is undefined for a single run.
 */
@AutoValue
public abstract class SuiteEntry {
  static SuiteEntry create(
      String label,
      int runs,
      ImmutableList<String> modelNames,
      ImmutableTable<String, Metric, MetricValue> means,
      ImmutableTable<String, Metric, MetricValue> standardDeviations,
      int nonConvergedRuns) {
    return new AutoValue_SuiteEntry(
        label, runs, modelNames, means, standardDeviations, nonConvergedRuns);
  }

  public abstract String label();

  public abstract int runs();

  public abstract ImmutableList<String> modelNames();

  /** Mean aggregate metric by model. */
  public abstract ImmutableTable<String, Metric, MetricValue> means();

  public abstract ImmutableTable<String, Metric, MetricValue> standardDeviations();

  /** Runs in which at least one model did not converge. */
  public abstract int nonConvergedRuns();
}
