package com.verlumen.forecastbench.experiment;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.series.Series;
import java.time.Duration;
import java.util.Optional;

/** Deterministic two-node series for experiment tests. */
final class TestSeries {
  static Series waves(int length) {
    double[][] values = new double[length][];
    for (int t = 0; t < length; t++) {
      values[t] =
          new double[] {50 + 10 * Math.sin(t * 0.25) + 0.01 * t, 20 + 4 * Math.cos(t * 0.15)};
    }
    return Series.create(
        Series.indexTimestamps(length, Duration.ofDays(1)),
        ImmutableList.of("alpha", "beta"),
        values,
        Duration.ofDays(1),
        Optional.empty());
  }

  private TestSeries() {}
}
