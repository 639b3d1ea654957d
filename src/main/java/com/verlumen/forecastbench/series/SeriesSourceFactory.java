package com.verlumen.forecastbench.series;

/** Creates the {@link SeriesSource} for a data set description. */
@FunctionalInterface
public interface SeriesSourceFactory {
  SeriesSource create(DatasetSpec spec);
}
