package com.verlumen.forecastbench.series;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * An immutable, uniformly sampled time series with one value per node and timestamp.
 *
 * <p>A univariate series has a single node. Values are stored as a {@code length x nodeCount}
 * matrix that is copied on the way in and never handed out, so windows may share the series by
 * reference.
 *
 * <p>Invariants, checked by {@link #create}:
 *
 * <ul>
 *   <li>at least one timestamp and one node, every row of the same width;
 *   <li>every value is finite;
 *   <li>timestamps strictly increase;
 *   <li>when a gap tolerance is declared, no step exceeds {@code samplingInterval + tolerance}.
 * </ul>
 */
public final class Series {
  private final ImmutableList<Instant> timestamps;
  private final ImmutableList<String> nodeNames;
  private final double[][] values;
  private final Duration samplingInterval;
  private final Optional<Duration> gapTolerance;

  private Series(
      ImmutableList<Instant> timestamps,
      ImmutableList<String> nodeNames,
      double[][] values,
      Duration samplingInterval,
      Optional<Duration> gapTolerance) {
    this.timestamps = timestamps;
    this.nodeNames = nodeNames;
    this.values = values;
    this.samplingInterval = samplingInterval;
    this.gapTolerance = gapTolerance;
  }

  /**
   * Creates a validated series.
   *
   * @param timestamps one timestamp per row, strictly increasing
   * @param nodeNames one name per column
   * @param values {@code timestamps.size() x nodeNames.size()} observations; copied
   * @param samplingInterval the nominal distance between consecutive timestamps
   * @param gapTolerance how much a step may exceed the sampling interval; empty disables the check
   * @throws DataSourceException if any invariant is violated
   */
  public static Series create(
      ImmutableList<Instant> timestamps,
      ImmutableList<String> nodeNames,
      double[][] values,
      Duration samplingInterval,
      Optional<Duration> gapTolerance) {
    checkNotNull(timestamps);
    checkNotNull(nodeNames);
    checkNotNull(values);
    checkNotNull(samplingInterval);
    checkNotNull(gapTolerance);
    if (timestamps.isEmpty()) {
      throw new DataSourceException("Series is empty");
    }
    if (nodeNames.isEmpty()) {
      throw new DataSourceException("Series has no value columns");
    }
    if (values.length != timestamps.size()) {
      throw new DataSourceException(
          String.format(
              "Series has %d timestamps but %d rows of values", timestamps.size(), values.length));
    }
    if (samplingInterval.isNegative() || samplingInterval.isZero()) {
      throw new DataSourceException("Sampling interval must be positive: " + samplingInterval);
    }
    double[][] copy = new double[values.length][];
    for (int t = 0; t < values.length; t++) {
      if (values[t] == null || values[t].length != nodeNames.size()) {
        throw new DataSourceException(
            String.format("Row %d does not have %d values", t, nodeNames.size()));
      }
      for (int n = 0; n < values[t].length; n++) {
        if (!Double.isFinite(values[t][n])) {
          throw new DataSourceException(
              String.format("Row %d, column '%s' is not finite", t, nodeNames.get(n)));
        }
      }
      copy[t] = values[t].clone();
    }
    Duration maxStep = gapTolerance.map(samplingInterval::plus).orElse(null);
    for (int t = 1; t < timestamps.size(); t++) {
      Duration step = Duration.between(timestamps.get(t - 1), timestamps.get(t));
      if (step.isNegative() || step.isZero()) {
        throw new DataSourceException(
            String.format(
                "Timestamps must strictly increase: %s follows %s",
                timestamps.get(t), timestamps.get(t - 1)));
      }
      if (maxStep != null && step.compareTo(maxStep) > 0) {
        throw new DataSourceException(
            String.format(
                "Gap of %s between %s and %s exceeds tolerance %s",
                step, timestamps.get(t - 1), timestamps.get(t), gapTolerance.get()));
      }
    }
    return new Series(timestamps, nodeNames, copy, samplingInterval, gapTolerance);
  }

  /**
   * Creates a single-node series stamped {@code EPOCH + i * samplingInterval}.
   */
  public static Series univariate(double[] values, Duration samplingInterval) {
    double[][] rows = new double[values.length][];
    for (int t = 0; t < values.length; t++) {
      rows[t] = new double[] {values[t]};
    }
    return create(
        indexTimestamps(values.length, samplingInterval),
        ImmutableList.of("value"),
        rows,
        samplingInterval,
        Optional.empty());
  }

  /** Timestamps {@code EPOCH, EPOCH + interval, ...} for series without a time column. */
  public static ImmutableList<Instant> indexTimestamps(int length, Duration samplingInterval) {
    return IntStream.range(0, length)
        .mapToObj(i -> Instant.EPOCH.plus(samplingInterval.multipliedBy(i)))
        .collect(ImmutableList.toImmutableList());
  }

  public int length() {
    return values.length;
  }

  public int nodeCount() {
    return nodeNames.size();
  }

  public double value(int index, int node) {
    checkElementIndex(index, values.length, "index");
    checkElementIndex(node, nodeNames.size(), "node");
    return values[index][node];
  }

  public Instant timestamp(int index) {
    return timestamps.get(index);
  }

  public ImmutableList<Instant> timestamps() {
    return timestamps;
  }

  public ImmutableList<String> nodeNames() {
    return nodeNames;
  }

  public Duration samplingInterval() {
    return samplingInterval;
  }

  public Optional<Duration> gapTolerance() {
    return gapTolerance;
  }

  @Override
  public String toString() {
    return String.format(
        "Series{length=%d, nodes=%d, from=%s, to=%s, interval=%s}",
        length(), nodeCount(), timestamps.get(0), timestamps.get(length() - 1), samplingInterval);
  }
}
