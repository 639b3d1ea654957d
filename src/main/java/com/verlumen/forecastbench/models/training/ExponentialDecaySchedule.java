package com.verlumen.forecastbench.models.training;

import static com.google.common.base.Preconditions.checkArgument;

/** Multiplies the learning rate by {@code decayRate} every {@code decayStep} epochs. */
public final class ExponentialDecaySchedule {
  private final double initialRate;
  private final int decayStep;
  private final double decayRate;

  private ExponentialDecaySchedule(double initialRate, int decayStep, double decayRate) {
    this.initialRate = initialRate;
    this.decayStep = decayStep;
    this.decayRate = decayRate;
  }

  public static ExponentialDecaySchedule create(
      double initialRate, int decayStep, double decayRate) {
    checkArgument(initialRate > 0, "initialRate must be positive: %s", initialRate);
    checkArgument(decayStep > 0, "decayStep must be positive: %s", decayStep);
    checkArgument(decayRate > 0 && decayRate <= 1, "decayRate must be in (0, 1]: %s", decayRate);
    return new ExponentialDecaySchedule(initialRate, decayStep, decayRate);
  }

  /** Learning rate for the 0-based {@code epoch}. */
  public double rateAt(int epoch) {
    checkArgument(epoch >= 0, "epoch must not be negative: %s", epoch);
    return initialRate * Math.pow(decayRate, epoch / decayStep);
  }
}
