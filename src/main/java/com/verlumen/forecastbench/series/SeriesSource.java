package com.verlumen.forecastbench.series;

/**
 * Supplies the cleaned, uniformly sampled series a run is evaluated on.
 *
 * <p>Implementations either return a validated {@link Series} or fail with {@link
 * DataSourceException}; they never return a partially read series.
 */
public interface SeriesSource {
  Series load();

  /** A short, file-system safe name for the data set, used in output paths. */
  String datasetName();
}
