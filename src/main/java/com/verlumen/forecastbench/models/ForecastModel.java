package com.verlumen.forecastbench.models;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.windowing.Window;
import com.verlumen.forecastbench.windowing.WindowPair;

/**
 * A forecaster the harness can train and query.
 *
 * <p>Instances are stateful and single-use: create one per run through its {@link ModelFactory}.
 * {@link #predict} must not modify the window or any shared state visible to other models, so
 * that different models can be evaluated concurrently on the same pairs.
 */
public interface ForecastModel {
  /** Stable identifier, used as the model's key in metric reports. */
  String name();

  /**
   * Learns from the training pairs.
   *
   * @param trainPairs chronologically ordered training pairs; not modified
   * @param listener receives per-epoch progress from iterative models
   * @return whether the fit converged and how it went
   */
  FitResult fit(ImmutableList<WindowPair> trainPairs, FitProgressListener listener);

  default FitResult fit(ImmutableList<WindowPair> trainPairs) {
    return fit(trainPairs, FitProgressListener.NONE);
  }

  /**
   * Predicts the horizon that follows {@code window}.
   *
   * @throws NotFittedException if the model needs training and {@link #fit} has not run
   * @throws IllegalArgumentException if the window does not match the model's shape
   */
  Forecast predict(Window window);

  /** Whether {@link #predict} may be called. Baselines are always ready. */
  boolean isFitted();
}
