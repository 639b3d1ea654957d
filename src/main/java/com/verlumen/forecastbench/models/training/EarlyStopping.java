package com.verlumen.forecastbench.models.training;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tracks validation losses and signals when they stopped improving.
 *
 * <p>Training should stop once {@code patience} consecutive validations fail to beat the best loss
 * seen so far.
 */
public final class EarlyStopping {
  private final int patience;
  private double bestLoss = Double.POSITIVE_INFINITY;
  private int validationsWithoutImprovement;

  private EarlyStopping(int patience) {
    this.patience = patience;
  }

  public static EarlyStopping create(int patience) {
    checkArgument(patience > 0, "patience must be positive: %s", patience);
    return new EarlyStopping(patience);
  }

  /**
   * Records a validation loss.
   *
   * @return whether it is a new best
   */
  public boolean record(double validationLoss) {
    if (validationLoss < bestLoss) {
      bestLoss = validationLoss;
      validationsWithoutImprovement = 0;
      return true;
    }
    validationsWithoutImprovement++;
    return false;
  }

  public boolean shouldStop() {
    return validationsWithoutImprovement >= patience;
  }

  public double bestLoss() {
    return bestLoss;
  }
}
