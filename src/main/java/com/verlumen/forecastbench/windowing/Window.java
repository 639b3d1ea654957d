package com.verlumen.forecastbench.windowing;

import com.verlumen.forecastbench.series.Series;

/** The {@code window_size} observations a model sees as input. */
public final class Window extends SeriesSlice {
  public Window(Series series, int start, int length) {
    super(series, start, length);
  }
}
