package com.verlumen.forecastbench.reporting;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.inject.Inject;
import com.verlumen.forecastbench.evaluation.Metric;
import com.verlumen.forecastbench.evaluation.MetricReport;
import com.verlumen.forecastbench.evaluation.MetricValue;
import com.verlumen.forecastbench.evaluation.PredictionRecord;
import java.util.Map;

/** Renders run reports and prediction records as JSON. Undefined metrics become {@code null}. */
public final class JsonReportRenderer implements ReportRenderer {
  private final Gson gson;

  @Inject
  JsonReportRenderer(Gson gson) {
    this.gson = gson;
  }

  @Override
  public String render(RunReport report) {
    JsonObject root = new JsonObject();
    root.addProperty("model", report.modelName());
    root.addProperty("dataset", report.datasetName());
    root.addProperty("window_size", report.windowSize());
    root.addProperty("horizon", report.horizon());

    JsonObject settings = new JsonObject();
    for (Map.Entry<String, String> setting : report.settings().entrySet()) {
      settings.addProperty(setting.getKey(), setting.getValue());
    }
    root.add("settings", settings);

    JsonObject series = new JsonObject();
    series.addProperty("length", report.seriesLength());
    series.addProperty("nodes", report.nodeCount());
    series.addProperty("start", report.seriesStart().toString());
    series.addProperty("end", report.seriesEnd().toString());
    root.add("series", series);

    JsonObject pairs = new JsonObject();
    pairs.addProperty("train", report.trainPairCount());
    pairs.addProperty("eval", report.evalPairCount());
    pairs.addProperty("purged", report.purgedPairCount());
    root.add("pairs", pairs);

    JsonArray fits = new JsonArray();
    for (FitSummary summary : report.fitSummaries()) {
      JsonObject fit = new JsonObject();
      fit.addProperty("model", summary.modelName());
      fit.addProperty("baseline", summary.baseline());
      fit.addProperty("converged", summary.result().converged());
      fit.addProperty("early_stopped", summary.result().earlyStopped());
      fit.addProperty("epochs", summary.result().epochs());
      fit.add("initial_loss", number(summary.result().initialLoss()));
      fit.add("final_loss", number(summary.result().finalLoss()));
      fit.addProperty("fit_millis", summary.fitDuration().toMillis());
      fits.add(fit);
    }
    root.add("fit", fits);

    JsonArray nonConverged = new JsonArray();
    report.nonConvergedModels().forEach(nonConverged::add);
    root.add("non_converged", nonConverged);

    root.add("metrics", metrics(report.metrics()));
    root.addProperty("evaluation_millis", report.evaluationDuration().toMillis());
    return gson.toJson(root);
  }

  /** Renders one model's prediction records, oldest window first. */
  public String renderPredictions(ImmutableList<PredictionRecord> records) {
    JsonArray array = new JsonArray();
    for (PredictionRecord record : records) {
      JsonObject entry = new JsonObject();
      entry.addProperty("window", record.windowIndex());
      entry.addProperty("model", record.modelName());
      entry.addProperty("target_start", record.actual().startTime().toString());
      JsonArray predicted = new JsonArray();
      JsonArray actual = new JsonArray();
      for (int step = 0; step < record.actual().length(); step++) {
        JsonArray predictedRow = new JsonArray();
        JsonArray actualRow = new JsonArray();
        for (int node = 0; node < record.actual().nodeCount(); node++) {
          predictedRow.add(number(record.predicted().value(step, node)));
          actualRow.add(record.actual().value(step, node));
        }
        predicted.add(predictedRow);
        actual.add(actualRow);
      }
      entry.add("predicted", predicted);
      entry.add("actual", actual);
      array.add(entry);
    }
    return gson.toJson(array);
  }

  private static JsonObject metrics(MetricReport report) {
    JsonObject models = new JsonObject();
    for (String model : report.modelNames()) {
      JsonObject entry = new JsonObject();
      JsonArray steps = new JsonArray();
      for (int step = 1; step <= report.horizon(model); step++) {
        JsonObject values = values(report.get(model, step));
        values.addProperty("step", step);
        steps.add(values);
      }
      entry.add("steps", steps);
      entry.add("aggregate", values(report.aggregate(model)));
      models.add(model, entry);
    }
    return models;
  }

  private static JsonObject values(ImmutableMap<Metric, MetricValue> values) {
    JsonObject object = new JsonObject();
    for (Map.Entry<Metric, MetricValue> value : values.entrySet()) {
      object.add(
          value.getKey().label(),
          value.getValue().isDefined()
              ? new JsonPrimitive(value.getValue().value())
              : JsonNull.INSTANCE);
    }
    return object;
  }

  private static JsonElement number(double value) {
    return Double.isFinite(value) ? new JsonPrimitive(value) : JsonNull.INSTANCE;
  }
}
