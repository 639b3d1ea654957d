package com.verlumen.forecastbench.windowing;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A chronological partition of window pairs.
 *
 * <p>Every training target ends at or before the first evaluation window starts. Pairs that would
 * straddle that boundary are dropped and counted in {@link #purgedCount()}.
 */
@AutoValue
public abstract class DatasetSplit {
  static DatasetSplit create(
      ImmutableList<WindowPair> train, ImmutableList<WindowPair> eval, int purgedCount) {
    return new AutoValue_DatasetSplit(train, eval, purgedCount);
  }

  public abstract ImmutableList<WindowPair> train();

  public abstract ImmutableList<WindowPair> eval();

  public abstract int purgedCount();
}
