package com.verlumen.forecastbench.models;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.forecastbench.models.baseline.MovingAverageModelFactory;
import com.verlumen.forecastbench.models.baseline.PersistenceModelFactory;
import com.verlumen.forecastbench.models.gwn.GwnModelFactory;

public class ModelsModule extends AbstractModule {
  public static ModelsModule create() {
    return new ModelsModule();
  }

  @Override
  protected void configure() {
    bind(ModelRegistry.class).to(ModelRegistryImpl.class);
  }

  /** Registration order is also the order baselines appear in reports. */
  @Provides
  ImmutableList<ModelFactory> provideModelFactories(
      GwnModelFactory gwnModelFactory,
      PersistenceModelFactory persistenceModelFactory,
      MovingAverageModelFactory movingAverageModelFactory) {
    return ImmutableList.of(gwnModelFactory, persistenceModelFactory, movingAverageModelFactory);
  }

  private ModelsModule() {}
}
