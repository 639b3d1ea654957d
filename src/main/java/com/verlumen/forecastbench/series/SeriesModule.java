package com.verlumen.forecastbench.series;

import com.google.inject.AbstractModule;

public class SeriesModule extends AbstractModule {
  public static SeriesModule create() {
    return new SeriesModule();
  }

  @Override
  protected void configure() {
    bind(SeriesSourceFactory.class).toInstance(CsvSeriesSource::create);
  }

  private SeriesModule() {}
}
