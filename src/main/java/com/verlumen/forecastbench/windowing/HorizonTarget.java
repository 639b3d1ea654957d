package com.verlumen.forecastbench.windowing;

import com.verlumen.forecastbench.series.Series;

/** The {@code horizon} observations immediately following a {@link Window}. */
public final class HorizonTarget extends SeriesSlice {
  public HorizonTarget(Series series, int start, int length) {
    super(series, start, length);
  }
}
