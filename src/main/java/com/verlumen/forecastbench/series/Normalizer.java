package com.verlumen.forecastbench.series;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Per-node affine scaling {@code (x - offset) / scale} fitted on a time range of a series.
 *
 * <p>Fitting only on the range a model trains on keeps evaluation data out of the statistics. A
 * node whose values do not vary keeps a scale of one.
 */
public final class Normalizer {
  private final NormMethod method;
  private final double[] offsets;
  private final double[] scales;

  private Normalizer(NormMethod method, double[] offsets, double[] scales) {
    this.method = method;
    this.offsets = offsets;
    this.scales = scales;
  }

  /**
   * Fits the scaling on rows {@code [fromInclusive, toExclusive)} of {@code series}.
   */
  public static Normalizer fit(
      NormMethod method, Series series, int fromInclusive, int toExclusive) {
    checkNotNull(method);
    checkArgument(
        0 <= fromInclusive && fromInclusive < toExclusive && toExclusive <= series.length(),
        "Invalid fit range [%s, %s) for series of length %s",
        fromInclusive,
        toExclusive,
        series.length());
    int nodes = series.nodeCount();
    double[] offsets = new double[nodes];
    double[] scales = new double[nodes];
    for (int n = 0; n < nodes; n++) {
      switch (method) {
        case Z_SCORE:
          fitZScore(series, n, fromInclusive, toExclusive, offsets, scales);
          break;
        case MIN_MAX:
          fitMinMax(series, n, fromInclusive, toExclusive, offsets, scales);
          break;
        case NONE:
          offsets[n] = 0.0;
          scales[n] = 1.0;
          break;
      }
    }
    return new Normalizer(method, offsets, scales);
  }

  public NormMethod method() {
    return method;
  }

  public int nodeCount() {
    return offsets.length;
  }

  public double normalize(double value, int node) {
    checkElementIndex(node, offsets.length, "node");
    return (value - offsets[node]) / scales[node];
  }

  public double denormalize(double value, int node) {
    checkElementIndex(node, offsets.length, "node");
    return value * scales[node] + offsets[node];
  }

  private static void fitZScore(
      Series series, int node, int from, int to, double[] offsets, double[] scales) {
    double sum = 0.0;
    for (int t = from; t < to; t++) {
      sum += series.value(t, node);
    }
    double mean = sum / (to - from);
    double squares = 0.0;
    for (int t = from; t < to; t++) {
      double d = series.value(t, node) - mean;
      squares += d * d;
    }
    double std = Math.sqrt(squares / (to - from));
    offsets[node] = mean;
    scales[node] = std > 0.0 ? std : 1.0;
  }

  private static void fitMinMax(
      Series series, int node, int from, int to, double[] offsets, double[] scales) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (int t = from; t < to; t++) {
      double v = series.value(t, node);
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    offsets[node] = min;
    scales[node] = max > min ? max - min : 1.0;
  }
}
