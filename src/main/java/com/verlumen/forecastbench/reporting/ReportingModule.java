package com.verlumen.forecastbench.reporting;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public class ReportingModule extends AbstractModule {
  public static ReportingModule create() {
    return new ReportingModule();
  }

  @Override
  protected void configure() {
    bind(ReportRenderer.class).to(TextReportRenderer.class);
  }

  /** Undefined metrics are written as explicit nulls. */
  @Provides
  @Singleton
  Gson provideGson() {
    return new GsonBuilder().setPrettyPrinting().serializeNulls().create();
  }

  private ReportingModule() {}
}
