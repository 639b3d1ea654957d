package com.verlumen.forecastbench.models;

/**
 * Creates fresh, unfitted instances of one model variant.
 *
 * <p>Implementations are registered with {@link ModelRegistry} under {@link #name()}.
 */
public interface ModelFactory {
  /** Registry key, upper case, e.g. {@code GWN}. */
  String name();

  /** Whether the variant is a zero-training baseline run by {@code --baseline}. */
  boolean isBaseline();

  ForecastModel create(ModelConfig config);
}
