package com.verlumen.forecastbench.models;

import com.google.common.collect.ImmutableList;

/**
 * Looks up model variants by name.
 *
 * <p>The set of variants is closed: it is fixed when the registry is built and lookups of any
 * other name fail fast with {@link UnknownModelException}.
 */
public interface ModelRegistry {
  /**
   * Returns the factory registered under {@code name}, ignoring case.
   *
   * @throws UnknownModelException if no variant has that name
   */
  ModelFactory getFactory(String name);

  /** Creates a fresh instance of the named variant. */
  default ForecastModel createModel(String name, ModelConfig config) {
    return getFactory(name).create(config);
  }

  /** Baseline factories in registration order. */
  ImmutableList<ModelFactory> baselines();

  /** All registered names in registration order. */
  ImmutableList<String> names();
}
