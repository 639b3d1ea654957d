package com.verlumen.forecastbench.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import java.util.HashSet;
import java.util.Set;

/**
 * Error metrics of one or more models, per 1-based horizon step and aggregated over the horizon.
 *
 * <p>A step's aggregate is the mean of its per-step values, and is undefined when any step is.
 * Reports are immutable and compare equal when every value is bit-identical.
 */
@AutoValue
public abstract class MetricReport {
  /**
   * Creates the report of a single model.
   *
   * @param steps metric values for steps {@code 1..steps.size()}, each holding every metric
   */
  public static MetricReport forModel(
      String modelName,
      ImmutableSet<Metric> metrics,
      ImmutableList<ImmutableMap<Metric, MetricValue>> steps) {
    checkArgument(!steps.isEmpty(), "A report needs at least one horizon step");
    checkArgument(!metrics.isEmpty(), "A report needs at least one metric");
    ImmutableTable.Builder<String, Integer, ImmutableMap<Metric, MetricValue>> stepTable =
        ImmutableTable.builder();
    for (int step = 0; step < steps.size(); step++) {
      checkArgument(
          steps.get(step).keySet().equals(metrics),
          "Step %s has metrics %s, expected %s",
          step + 1,
          steps.get(step).keySet(),
          metrics);
      stepTable.put(modelName, step + 1, steps.get(step));
    }

    ImmutableTable.Builder<String, Metric, MetricValue> aggregates = ImmutableTable.builder();
    for (Metric metric : metrics) {
      aggregates.put(modelName, metric, meanOverSteps(metric, steps));
    }
    return new AutoValue_MetricReport(
        ImmutableList.of(modelName), metrics, stepTable.build(), aggregates.build());
  }

  /**
   * Combines the reports of different models, keeping their order.
   *
   * @throws IllegalArgumentException if a model appears twice or the metric sets differ
   */
  public static MetricReport merge(Iterable<MetricReport> reports) {
    ImmutableList.Builder<String> modelNames = ImmutableList.builder();
    ImmutableTable.Builder<String, Integer, ImmutableMap<Metric, MetricValue>> steps =
        ImmutableTable.builder();
    ImmutableTable.Builder<String, Metric, MetricValue> aggregates = ImmutableTable.builder();
    Set<String> seen = new HashSet<>();
    ImmutableSet<Metric> metrics = null;
    for (MetricReport report : reports) {
      if (metrics == null) {
        metrics = report.metrics();
      }
      checkArgument(
          report.metrics().equals(metrics),
          "Cannot merge reports over %s and %s",
          metrics,
          report.metrics());
      for (String modelName : report.modelNames()) {
        checkArgument(seen.add(modelName), "Model %s is already in the report", modelName);
      }
      modelNames.addAll(report.modelNames());
      steps.putAll(report.steps());
      aggregates.putAll(report.aggregates());
    }
    checkArgument(metrics != null, "Nothing to merge");
    return new AutoValue_MetricReport(
        modelNames.build(), metrics, steps.build(), aggregates.build());
  }

  /** Models in the order they were evaluated. */
  public abstract ImmutableList<String> modelNames();

  public abstract ImmutableSet<Metric> metrics();

  /** Rows are model names, columns 1-based horizon steps. */
  public abstract ImmutableTable<String, Integer, ImmutableMap<Metric, MetricValue>> steps();

  public abstract ImmutableTable<String, Metric, MetricValue> aggregates();

  public int horizon(String modelName) {
    checkModel(modelName);
    return steps().row(modelName).size();
  }

  /** Every metric of {@code modelName} at 1-based {@code step}. */
  public ImmutableMap<Metric, MetricValue> get(String modelName, int step) {
    checkModel(modelName);
    ImmutableMap<Metric, MetricValue> values = steps().get(modelName, step);
    checkArgument(values != null, "%s has no step %s", modelName, step);
    return values;
  }

  public MetricValue value(String modelName, int step, Metric metric) {
    MetricValue value = get(modelName, step).get(metric);
    checkArgument(value != null, "Metric %s was not computed", metric);
    return value;
  }

  public ImmutableMap<Metric, MetricValue> aggregate(String modelName) {
    checkModel(modelName);
    return aggregates().row(modelName);
  }

  private void checkModel(String modelName) {
    checkArgument(modelNames().contains(modelName), "No results for model %s", modelName);
  }

  private static MetricValue meanOverSteps(
      Metric metric, ImmutableList<ImmutableMap<Metric, MetricValue>> steps) {
    double sum = 0.0;
    for (ImmutableMap<Metric, MetricValue> step : steps) {
      MetricValue value = step.get(metric);
      if (!value.isDefined()) {
        return MetricValue.undefined();
      }
      sum += value.value();
    }
    return MetricValue.orUndefined(sum / steps.size());
  }
}
