package com.verlumen.forecastbench.models;

/** Receives per-epoch progress from iterative models. */
@FunctionalInterface
public interface FitProgressListener {
  FitProgressListener NONE = (epoch, trainLoss) -> {};

  /**
   * Called after each completed epoch.
   *
   * @param epoch 1-based epoch number
   * @param trainLoss mean training loss of the epoch
   */
  void onEpoch(int epoch, double trainLoss);
}
