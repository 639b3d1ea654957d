package com.verlumen.forecastbench.evaluation;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/** Error metrics the evaluator can report. */
public enum Metric {
  MAE("mae"),
  RMSE("rmse"),
  /** Mean absolute percentage error, in percent. */
  MAPE("mape");

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final String label;

  Metric(String label) {
    this.label = label;
  }

  /** The lower-case name used on the command line and in reports. */
  public String label() {
    return label;
  }

  /**
   * Parses a metric name, ignoring case.
   *
   * @throws IllegalArgumentException if {@code name} is not a metric
   */
  public static Metric fromString(String name) {
    for (Metric metric : values()) {
      if (metric.label.equals(Ascii.toLowerCase(name.trim()))) {
        return metric;
      }
    }
    throw new IllegalArgumentException("Unknown metric: " + name);
  }

  /** Parses a comma-separated list such as {@code "mae,rmse"}, keeping its order. */
  public static ImmutableSet<Metric> parseList(String names) {
    ImmutableSet.Builder<Metric> metrics = ImmutableSet.builder();
    for (String name : LIST_SPLITTER.split(names)) {
      metrics.add(fromString(name));
    }
    ImmutableSet<Metric> parsed = metrics.build();
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException("At least one metric is required");
    }
    return parsed;
  }
}
