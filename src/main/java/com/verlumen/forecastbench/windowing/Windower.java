package com.verlumen.forecastbench.windowing;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.series.Series;

/**
 * Slices a series into (window, horizon target) pairs and partitions them chronologically.
 *
 * <p>Both operations are pure: the same arguments always give equal results.
 */
public interface Windower {
  /**
   * Builds every pair whose window starts at a multiple of {@code stride}, oldest first.
   *
   * @param series the series to slice; shared by reference with every produced slice
   * @param windowSize input length, positive
   * @param horizon target length, positive
   * @param stride distance between consecutive window starts, at least one
   * @return {@code floor((len - windowSize - horizon) / stride) + 1} pairs in temporal order
   * @throws InsufficientDataException if {@code series.length() < windowSize + horizon}
   * @throws IllegalArgumentException if a size argument is out of range
   */
  ImmutableList<WindowPair> build(Series series, int windowSize, int horizon, int stride);

  /** Equivalent to {@code build(series, windowSize, horizon, 1)}. */
  default ImmutableList<WindowPair> build(Series series, int windowSize, int horizon) {
    return build(series, windowSize, horizon, 1);
  }

  /**
   * Splits pairs into a training and an evaluation subset by time.
   *
   * <p>The last {@code floor(pairs.size() * evalFraction)} pairs form the evaluation subset. Every
   * earlier pair whose target ends at or before the first evaluation window starts is used for
   * training; pairs in between are purged so no training target overlaps evaluation inputs.
   *
   * @throws InvalidSplitException if {@code evalFraction} is not in (0, 1) or either side is empty
   */
  DatasetSplit split(ImmutableList<WindowPair> pairs, double evalFraction);
}
