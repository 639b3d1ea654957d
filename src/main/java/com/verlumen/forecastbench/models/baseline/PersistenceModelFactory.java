package com.verlumen.forecastbench.models.baseline;

import com.google.inject.Inject;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.ModelFactory;

public final class PersistenceModelFactory implements ModelFactory {
  @Inject
  PersistenceModelFactory() {}

  public static PersistenceModelFactory create() {
    return new PersistenceModelFactory();
  }

  @Override
  public String name() {
    return PersistenceModel.NAME;
  }

  @Override
  public boolean isBaseline() {
    return true;
  }

  @Override
  public ForecastModel create(ModelConfig config) {
    return new PersistenceModel(config);
  }
}
