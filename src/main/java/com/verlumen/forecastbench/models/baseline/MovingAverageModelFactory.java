package com.verlumen.forecastbench.models.baseline;

import com.google.inject.Inject;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.models.ModelFactory;

public final class MovingAverageModelFactory implements ModelFactory {
  @Inject
  MovingAverageModelFactory() {}

  public static MovingAverageModelFactory create() {
    return new MovingAverageModelFactory();
  }

  @Override
  public String name() {
    return MovingAverageModel.NAME;
  }

  @Override
  public boolean isBaseline() {
    return true;
  }

  @Override
  public ForecastModel create(ModelConfig config) {
    return new MovingAverageModel(config);
  }
}
