package com.verlumen.forecastbench.experiment.grid;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.forecastbench.evaluation.Metric;

/** The entries of a completed grid, in expansion order. */
@AutoValue
public abstract class ExperimentSuiteResult {
  static ExperimentSuiteResult create(
      ImmutableSet<Metric> metrics, ImmutableList<SuiteEntry> entries) {
    return new AutoValue_ExperimentSuiteResult(metrics, entries);
  }

  public abstract ImmutableSet<Metric> metrics();

  public abstract ImmutableList<SuiteEntry> entries();
}
