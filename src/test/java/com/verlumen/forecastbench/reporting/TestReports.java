package com.verlumen.forecastbench.reporting;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.MetricValue;
import com.verlumen.forecastbench.evaluation.PredictionRecord;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.series.Series;
import com.verlumen.forecastbench.windowing.HorizonTarget;
import java.time.Duration;
import java.time.Instant;

/** Small run reports for renderer and writer tests. */
final class TestReports {
  static final ImmutableSet<Metric> METRICS = ImmutableSet.of(Metric.MAE, Metric.MAPE);

  static RunReport.Builder gwnWithPersistence() {
    FitResult gwnFit =
        FitResult.builder()
            .setConverged(false)
            .setEarlyStopped(false)
            .setEpochs(50)
            .setInitialLoss(1.5)
            .setFinalLoss(0.25)
            .build();
    MetricReport metrics =
        MetricReport.merge(
            ImmutableList.of(
                MetricReport.forModel(
                    "GWN",
                    METRICS,
                    ImmutableList.of(
                        ImmutableMap.of(
                            Metric.MAE, MetricValue.of(1.0), Metric.MAPE, MetricValue.of(2.0)),
                        ImmutableMap.of(
                            Metric.MAE, MetricValue.of(3.0), Metric.MAPE, MetricValue.of(4.0)))),
                MetricReport.forModel(
                    "PERSISTENCE",
                    METRICS,
                    ImmutableList.of(
                        ImmutableMap.of(
                            Metric.MAE, MetricValue.of(2.0), Metric.MAPE, MetricValue.undefined()),
                        ImmutableMap.of(
                            Metric.MAE,
                            MetricValue.of(4.0),
                            Metric.MAPE,
                            MetricValue.undefined())))));
    return RunReport.builder()
        .setModelName("GWN")
        .setDatasetName("prices")
        .setWindowSize(12)
        .setHorizon(2)
        .setSettings(ImmutableMap.of("model", "GWN", "window_size", "12", "horizon", "2"))
        .setSeriesLength(100)
        .setNodeCount(1)
        .setSeriesStart(Instant.parse("2020-01-01T00:00:00Z"))
        .setSeriesEnd(Instant.parse("2020-04-09T00:00:00Z"))
        .setTrainPairCount(60)
        .setEvalPairCount(17)
        .setPurgedPairCount(10)
        .setFitSummaries(
            ImmutableList.of(
                FitSummary.create("GWN", false, gwnFit, Duration.ofMillis(1200)),
                FitSummary.create("PERSISTENCE", true, FitResult.noOp(), Duration.ZERO)))
        .setMetrics(metrics)
        .setEvaluationDuration(Duration.ofMillis(30));
  }

  static PredictionRecord record(int windowIndex, String modelName, double predicted) {
    Series series = Series.univariate(new double[] {1.0, 2.0, 3.0}, Duration.ofDays(1));
    return PredictionRecord.create(
        windowIndex,
        modelName,
        Forecast.of(new double[][] {{predicted}}),
        new HorizonTarget(series, 2, 1));
  }

  private TestReports() {}
}
