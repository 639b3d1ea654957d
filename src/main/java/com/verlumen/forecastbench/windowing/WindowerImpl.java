package com.verlumen.forecastbench.windowing;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.forecastbench.series.Series;

final class WindowerImpl implements Windower {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  WindowerImpl() {}

  @Override
  public ImmutableList<WindowPair> build(Series series, int windowSize, int horizon, int stride) {
    checkNotNull(series, "Series cannot be null");
    checkArgument(windowSize > 0, "window_size must be positive: %s", windowSize);
    checkArgument(horizon > 0, "horizon must be positive: %s", horizon);
    checkArgument(stride >= 1, "stride must be at least 1: %s", stride);

    long required = (long) windowSize + horizon;
    if (series.length() < required) {
      throw new InsufficientDataException(series.length(), required);
    }

    int count = (int) ((series.length() - required) / stride + 1);
    ImmutableList.Builder<WindowPair> pairs = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      int start = i * stride;
      pairs.add(
          WindowPair.create(
              i,
              new Window(series, start, windowSize),
              new HorizonTarget(series, start + windowSize, horizon)));
    }
    logger.atFine().log(
        "Built %d pairs (window_size=%d, horizon=%d, stride=%d) from %d samples",
        count, windowSize, horizon, stride, series.length());
    return pairs.build();
  }

  @Override
  public DatasetSplit split(ImmutableList<WindowPair> pairs, double evalFraction) {
    checkNotNull(pairs, "Pairs cannot be null");
    if (!(evalFraction > 0.0 && evalFraction < 1.0)) {
      throw new InvalidSplitException(
          "eval_fraction must be strictly between 0 and 1: " + evalFraction);
    }

    int evalCount = (int) Math.floor(pairs.size() * evalFraction);
    if (evalCount == 0) {
      throw new InvalidSplitException(
          String.format(
              "eval_fraction %s of %d pairs leaves no evaluation pairs",
              evalFraction, pairs.size()));
    }

    int evalFrom = pairs.size() - evalCount;
    int boundary = pairs.get(evalFrom).window().start();
    int trainCount = 0;
    while (trainCount < evalFrom && pairs.get(trainCount).target().end() <= boundary) {
      trainCount++;
    }
    if (trainCount == 0) {
      throw new InvalidSplitException(
          String.format(
              "eval_fraction %s of %d pairs leaves no training pairs that end before the"
                  + " evaluation windows start",
              evalFraction, pairs.size()));
    }

    return DatasetSplit.create(
        pairs.subList(0, trainCount), pairs.subList(evalFrom, pairs.size()), evalFrom - trainCount);
  }
}
