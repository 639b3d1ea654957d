package com.verlumen.forecastbench.reporting;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.MetricValue;
import java.util.Map;

/**
 * Renders a run report as plain-text tables: one row per model and horizon step, followed by the
 * aggregate row of each model.
 */
public final class TextReportRenderer implements ReportRenderer {
  private static final int MODEL_COLUMN = 16;
  private static final int STEP_COLUMN = 10;
  private static final int VALUE_COLUMN = 12;

  @Inject
  TextReportRenderer() {}

  @Override
  public String render(RunReport report) {
    StringBuilder text = new StringBuilder();
    text.append(
        String.format(
            "Run: model=%s dataset=%s window_size=%d horizon=%d%n",
            report.modelName(), report.datasetName(), report.windowSize(), report.horizon()));
    text.append(
        String.format(
            "Series: %d samples x %d nodes, %s to %s%n",
            report.seriesLength(), report.nodeCount(), report.seriesStart(), report.seriesEnd()));
    text.append(
        String.format(
            "Pairs: train=%d eval=%d purged=%d%n",
            report.trainPairCount(), report.evalPairCount(), report.purgedPairCount()));
    for (Map.Entry<String, String> setting : report.settings().entrySet()) {
      text.append(String.format("  %s=%s%n", setting.getKey(), setting.getValue()));
    }

    text.append(String.format("%nFit:%n"));
    for (FitSummary summary : report.fitSummaries()) {
      text.append(
          String.format(
              "  %s converged=%s epochs=%d initial_loss=%.6f final_loss=%.6f time=%dms%s%n",
              Strings.padEnd(summary.modelName(), MODEL_COLUMN, ' '),
              summary.result().converged(),
              summary.result().epochs(),
              summary.result().initialLoss(),
              summary.result().finalLoss(),
              summary.fitDuration().toMillis(),
              summary.result().earlyStopped() ? " (early stopped)" : ""));
    }
    if (!report.nonConvergedModels().isEmpty()) {
      text.append(String.format("  NOT CONVERGED: %s%n", report.nonConvergedModels()));
    }

    MetricReport metrics = report.metrics();
    text.append(String.format("%n")).append(header(metrics));
    for (String model : metrics.modelNames()) {
      for (int step = 1; step <= metrics.horizon(model); step++) {
        text.append(row(metrics, model, String.valueOf(step), metrics.get(model, step)));
      }
      text.append(row(metrics, model, "aggregate", metrics.aggregate(model)));
    }
    text.append(
        String.format("%nEvaluation time: %dms%n", report.evaluationDuration().toMillis()));
    return text.toString();
  }

  private static String header(MetricReport metrics) {
    StringBuilder line = new StringBuilder();
    line.append(Strings.padEnd("model", MODEL_COLUMN, ' '));
    line.append(Strings.padStart("step", STEP_COLUMN, ' '));
    for (Metric metric : metrics.metrics()) {
      line.append(Strings.padStart(metric.label(), VALUE_COLUMN, ' '));
    }
    return line.append(String.format("%n")).toString();
  }

  private static String row(
      MetricReport metrics, String model, String step, ImmutableMap<Metric, MetricValue> values) {
    StringBuilder line = new StringBuilder();
    line.append(Strings.padEnd(model, MODEL_COLUMN, ' '));
    line.append(Strings.padStart(step, STEP_COLUMN, ' '));
    for (Metric metric : metrics.metrics()) {
      line.append(Strings.padStart(values.get(metric).toString(), VALUE_COLUMN, ' '));
    }
    return line.append(String.format("%n")).toString();
  }
}
