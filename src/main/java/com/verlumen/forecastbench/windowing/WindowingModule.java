package com.verlumen.forecastbench.windowing;

import com.google.inject.AbstractModule;

public class WindowingModule extends AbstractModule {
  public static WindowingModule create() {
    return new WindowingModule();
  }

  @Override
  protected void configure() {
    bind(Windower.class).to(WindowerImpl.class);
  }

  private WindowingModule() {}
}
