package com.verlumen.forecastbench.experiment.grid;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.Stats;
import com.google.inject.Inject;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.MetricValue;
import com.verlumen.forecastbench.experiment.ExperimentConfig;
import com.verlumen.forecastbench.experiment.ExperimentOrchestrator;
import com.verlumen.forecastbench.models.TrainingConfig;
import com.verlumen.forecastbench.reporting.RunReport;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every configuration of a grid, each repeated with seeds {@code seed, seed + 1, ...}, and
 * summarises the aggregate metrics. The first failing run fails the whole suite.
 */
public final class ExperimentSuite {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ExperimentOrchestrator.Factory orchestratorFactory;

  @Inject
  ExperimentSuite(ExperimentOrchestrator.Factory orchestratorFactory) {
    this.orchestratorFactory = orchestratorFactory;
  }

  public ExperimentSuiteResult run(GridSpec spec, ExperimentConfig base) {
    ImmutableList<GridPoint> points = GridExpander.expand(spec, base);
    logger.atInfo().log(
        "Running %d configurations x %d runs", points.size(), spec.getRuns());
    ImmutableList.Builder<SuiteEntry> entries = ImmutableList.builder();
    for (GridPoint point : points) {
      entries.add(runPoint(point, spec.getRuns()));
    }
    return ExperimentSuiteResult.create(base.metrics(), entries.build());
  }

  private SuiteEntry runPoint(GridPoint point, int runs) {
    List<MetricReport> reports = new ArrayList<>();
    int nonConvergedRuns = 0;
    for (int run = 0; run < runs; run++) {
      TrainingConfig training =
          point.config().training().toBuilder()
              .setSeed(point.config().training().seed() + run)
              .build();
      ExperimentConfig config = point.config().toBuilder().setTraining(training).build();
      logger.atInfo().log("Configuration %s, run %d of %d", point.label(), run + 1, runs);
      RunReport report = orchestratorFactory.create(config).run();
      reports.add(report.metrics());
      if (!report.nonConvergedModels().isEmpty()) {
        nonConvergedRuns++;
      }
    }

    ImmutableList<String> modelNames = reports.get(0).modelNames();
    ImmutableTable.Builder<String, Metric, MetricValue> means = ImmutableTable.builder();
    ImmutableTable.Builder<String, Metric, MetricValue> deviations = ImmutableTable.builder();
    for (String model : modelNames) {
      for (Metric metric : reports.get(0).metrics()) {
        List<Double> values = new ArrayList<>();
        for (MetricReport report : reports) {
          MetricValue value = report.aggregate(model).get(metric);
          if (value.isDefined()) {
            values.add(value.value());
          }
        }
        if (values.size() < reports.size()) {
          means.put(model, metric, MetricValue.undefined());
          deviations.put(model, metric, MetricValue.undefined());
          continue;
        }
        Stats stats = Stats.of(values);
        means.put(model, metric, MetricValue.of(stats.mean()));
        deviations.put(
            model,
            metric,
            stats.count() > 1
                ? MetricValue.of(stats.sampleStandardDeviation())
                : MetricValue.undefined());
      }
    }
    return SuiteEntry.create(
        point.label(), runs, modelNames, means.build(), deviations.build(), nonConvergedRuns);
  }
}
