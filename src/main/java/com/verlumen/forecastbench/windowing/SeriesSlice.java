package com.verlumen.forecastbench.windowing;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.forecastbench.series.Series;
import java.time.Instant;

/**
 * A contiguous, read-only view of {@code length} rows of a {@link Series} starting at {@code
 * start}.
 *
 * <p>Slices never copy the series. Two slices are equal when they have the same position and the
 * same values, wherever their series came from.
 */
public abstract class SeriesSlice {
  private final Series series;
  private final int start;
  private final int length;

  SeriesSlice(Series series, int start, int length) {
    this.series = checkNotNull(series);
    checkArgument(length > 0, "Slice length must be positive: %s", length);
    checkArgument(
        start >= 0 && start + length <= series.length(),
        "Slice [%s, %s) is outside series of length %s",
        start,
        start + length,
        series.length());
    this.start = start;
    this.length = length;
  }

  /** The series this slice views. */
  public final Series series() {
    return series;
  }

  /** Index of the first row in the underlying series. */
  public final int start() {
    return start;
  }

  /** Index one past the last row in the underlying series. */
  public final int end() {
    return start + length;
  }

  public final int length() {
    return length;
  }

  public final int nodeCount() {
    return series.nodeCount();
  }

  /** Value at {@code step} (0-based, relative to this slice) for {@code node}. */
  public final double value(int step, int node) {
    checkElementIndex(step, length, "step");
    return series.value(start + step, node);
  }

  /** The slice values of one node, oldest first, in a fresh array. */
  public final double[] column(int node) {
    double[] column = new double[length];
    for (int step = 0; step < length; step++) {
      column[step] = series.value(start + step, node);
    }
    return column;
  }

  /** The last value of {@code node} in this slice. */
  public final double last(int node) {
    return series.value(end() - 1, node);
  }

  public final Instant startTime() {
    return series.timestamp(start);
  }

  public final Instant endTime() {
    return series.timestamp(end() - 1);
  }

  @Override
  public final boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || other.getClass() != getClass()) {
      return false;
    }
    SeriesSlice that = (SeriesSlice) other;
    if (start != that.start || length != that.length || nodeCount() != that.nodeCount()) {
      return false;
    }
    for (int step = 0; step < length; step++) {
      for (int node = 0; node < nodeCount(); node++) {
        if (Double.compare(value(step, node), that.value(step, node)) != 0) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public final int hashCode() {
    int hash = 31 * start + length;
    for (int step = 0; step < length; step++) {
      for (int node = 0; node < nodeCount(); node++) {
        hash = 31 * hash + Double.hashCode(value(step, node));
      }
    }
    return hash;
  }

  @Override
  public String toString() {
    return String.format(
        "%s{start=%d, length=%d, nodes=%d}",
        getClass().getSimpleName(), start, length, nodeCount());
  }
}
