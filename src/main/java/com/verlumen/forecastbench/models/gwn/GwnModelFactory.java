package com.verlumen.forecastbench.models.gwn;

import com.google.inject.Inject;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.ModelFactory;
import com.verlumen.forecastbench.windowing.Windower;

public final class GwnModelFactory implements ModelFactory {
  private final Windower windower;

  @Inject
  GwnModelFactory(Windower windower) {
    this.windower = windower;
  }

  public static GwnModelFactory create(Windower windower) {
    return new GwnModelFactory(windower);
  }

  @Override
  public String name() {
    return GwnModel.NAME;
  }

  @Override
  public boolean isBaseline() {
    return false;
  }

  @Override
  public ForecastModel create(ModelConfig config) {
    return new GwnModel(config, windower);
  }
}
