package com.verlumen.forecastbench.reporting;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.PredictionRecord;
import java.time.Duration;
import java.time.Instant;

/**
 * Everything a completed run produced: what was run, on which data, how each model fit, and the
 * merged metric report. Prediction records are only kept when they are to be saved.
 */
@AutoValue
public abstract class RunReport {
  public static Builder builder() {
    return new AutoValue_RunReport.Builder().setPredictions(ImmutableMap.of());
  }

  /** The primary model name, as registered. */
  public abstract String modelName();

  public abstract String datasetName();

  public abstract int windowSize();

  public abstract int horizon();

  /** The run's settings, flag name to value, for the report header. */
  public abstract ImmutableMap<String, String> settings();

  public abstract int seriesLength();

  public abstract int nodeCount();

  public abstract Instant seriesStart();

  public abstract Instant seriesEnd();

  public abstract int trainPairCount();

  public abstract int evalPairCount();

  /** Pairs dropped between the training and evaluation subsets. */
  public abstract int purgedPairCount();

  /** One entry per evaluated model, in report order. */
  public abstract ImmutableList<FitSummary> fitSummaries();

  public abstract MetricReport metrics();

  public abstract Duration evaluationDuration();

  /** Prediction records by model name; empty unless predictions are saved. */
  public abstract ImmutableMap<String, ImmutableList<PredictionRecord>> predictions();

  /** Models whose fit exhausted its epochs before converging. */
  public ImmutableList<String> nonConvergedModels() {
    return fitSummaries().stream()
        .filter(summary -> !summary.result().converged())
        .map(FitSummary::modelName)
        .collect(ImmutableList.toImmutableList());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setModelName(String modelName);

    public abstract Builder setDatasetName(String datasetName);

    public abstract Builder setWindowSize(int windowSize);

    public abstract Builder setHorizon(int horizon);

    public abstract Builder setSettings(ImmutableMap<String, String> settings);

    public abstract Builder setSeriesLength(int seriesLength);

    public abstract Builder setNodeCount(int nodeCount);

    public abstract Builder setSeriesStart(Instant seriesStart);

    public abstract Builder setSeriesEnd(Instant seriesEnd);

    public abstract Builder setTrainPairCount(int trainPairCount);

    public abstract Builder setEvalPairCount(int evalPairCount);

    public abstract Builder setPurgedPairCount(int purgedPairCount);

    public abstract Builder setFitSummaries(ImmutableList<FitSummary> fitSummaries);

    public abstract Builder setMetrics(MetricReport metrics);

    public abstract Builder setEvaluationDuration(Duration evaluationDuration);

    public abstract Builder setPredictions(
        ImmutableMap<String, ImmutableList<PredictionRecord>> predictions);

    public abstract RunReport build();
  }
}
