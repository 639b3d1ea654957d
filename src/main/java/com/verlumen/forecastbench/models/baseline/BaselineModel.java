package com.verlumen.forecastbench.models.baseline;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.models.FitProgressListener;
import com.verlumen.forecastbench.models.FitResult;
import com.verlumen.forecastbench.models.Forecast;
import com.verlumen.forecastbench.models.ForecastModel;
import com.verlumen.forecastbench.models.ModelConfig;
import com.verlumen.forecastbench.windowing.Window;
import com.verlumen.forecastbench.windowing.WindowPair;

/**
 * A zero-training predictor that repeats one value per node across the horizon.
 *
 * <p>Baselines are deterministic and stateless, so {@link #fit} does nothing and {@link #predict}
 * works on a fresh instance.
 */
abstract class BaselineModel implements ForecastModel {
  private final ModelConfig config;

  BaselineModel(ModelConfig config) {
    this.config = checkNotNull(config);
  }

  /** The value repeated for {@code node} at every horizon step. */
  abstract double level(Window window, int node);

  @Override
  public final FitResult fit(ImmutableList<WindowPair> trainPairs, FitProgressListener listener) {
    return FitResult.noOp();
  }

  @Override
  public final Forecast predict(Window window) {
    checkNotNull(window, "Window cannot be null");
    checkArgument(
        window.length() == config.windowSize(),
        "%s expects windows of %s steps, got %s",
        name(),
        config.windowSize(),
        window.length());
    double[] levels = new double[window.nodeCount()];
    for (int node = 0; node < levels.length; node++) {
      levels[node] = level(window, node);
    }
    return Forecast.repeat(config.horizon(), levels);
  }

  @Override
  public final boolean isFitted() {
    return true;
  }
}
