package com.verlumen.forecastbench.models;

import static java.util.function.Function.identity;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.mu.util.stream.BiStream;

final class ModelRegistryImpl implements ModelRegistry {
  private final ImmutableMap<String, ModelFactory> factoryMap;

  @Inject
  ModelRegistryImpl(ImmutableList<ModelFactory> factories) {
    this.factoryMap =
        BiStream.from(factories, factory -> Ascii.toUpperCase(factory.name()), identity())
            .collect(ImmutableMap::toImmutableMap);
  }

  @Override
  public ModelFactory getFactory(String name) {
    ModelFactory factory = name == null ? null : factoryMap.get(Ascii.toUpperCase(name.trim()));
    if (factory == null) {
      throw new UnknownModelException(name, names());
    }

    return factory;
  }

  @Override
  public ImmutableList<ModelFactory> baselines() {
    return factoryMap.values().stream()
        .filter(ModelFactory::isBaseline)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public ImmutableList<String> names() {
    return factoryMap.keySet().asList();
  }
}
