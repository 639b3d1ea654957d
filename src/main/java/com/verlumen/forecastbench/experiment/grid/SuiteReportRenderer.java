package com.verlumen.forecastbench.experiment.grid;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.inject.Inject;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricValue;
import com.verlumen.forecastbench.reporting.ReportWriter;
import java.nio.file.Path;

/** Renders grid results as a text table and writes them to {@code suite.json}. */
public final class SuiteReportRenderer {
  static final String SUITE_REPORT = "suite.json";

  private final Gson gson;

  @Inject
  SuiteReportRenderer(Gson gson) {
    this.gson = gson;
  }

  public String renderText(ExperimentSuiteResult result) {
    StringBuilder text = new StringBuilder();
    for (SuiteEntry entry : result.entries()) {
      text.append(
          String.format(
              "%s (runs=%d, non-converged=%d)%n",
              entry.label(), entry.runs(), entry.nonConvergedRuns()));
      for (String model : entry.modelNames()) {
        text.append("  ").append(Strings.padEnd(model, 16, ' '));
        for (Metric metric : result.metrics()) {
          text.append(
              String.format(
                  "  %s=%s+/-%s",
                  metric.label(),
                  entry.means().get(model, metric),
                  entry.standardDeviations().get(model, metric)));
        }
        text.append(String.format("%n"));
      }
    }
    return text.toString();
  }

  public String renderJson(ExperimentSuiteResult result) {
    JsonArray entries = new JsonArray();
    for (SuiteEntry entry : result.entries()) {
      JsonObject object = new JsonObject();
      object.addProperty("label", entry.label());
      object.addProperty("runs", entry.runs());
      object.addProperty("non_converged_runs", entry.nonConvergedRuns());
      JsonObject models = new JsonObject();
      for (String model : entry.modelNames()) {
        JsonObject metrics = new JsonObject();
        for (Metric metric : result.metrics()) {
          JsonObject summary = new JsonObject();
          summary.add("mean", json(entry.means().get(model, metric)));
          summary.add("std", json(entry.standardDeviations().get(model, metric)));
          metrics.add(metric.label(), summary);
        }
        models.add(model, metrics);
      }
      object.add("models", models);
      entries.add(object);
    }
    return gson.toJson(entries);
  }

  /** Writes {@code suite.json} under {@code outputDir} and returns its path. */
  public Path write(ExperimentSuiteResult result, Path outputDir) {
    Path file = outputDir.resolve(SUITE_REPORT);
    ReportWriter.writeFile(file, renderJson(result));
    return file;
  }

  private static JsonElement json(MetricValue value) {
    return value.isDefined() ? new JsonPrimitive(value.value()) : JsonNull.INSTANCE;
  }
}
