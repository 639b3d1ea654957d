package com.verlumen.forecastbench.models;

import com.google.auto.value.AutoValue;

/**
 * Outcome of {@link ForecastModel#fit}.
 *
 * <p>A model that is not {@link #converged()} exhausted its epoch budget before the loss settled.
 * It can still predict; the run report flags it.
 */
@AutoValue
public abstract class FitResult {
  private static final FitResult NO_OP = builder()
      .setConverged(true)
      .setEarlyStopped(false)
      .setEpochs(0)
      .setInitialLoss(0.0)
      .setFinalLoss(0.0)
      .build();

  /** The result of a fit that has nothing to learn. */
  public static FitResult noOp() {
    return NO_OP;
  }

  public static Builder builder() {
    return new AutoValue_FitResult.Builder();
  }

  public abstract boolean converged();

  /** Whether training stopped because the validation loss stopped improving. */
  public abstract boolean earlyStopped();

  public abstract int epochs();

  /** Mean training loss of the first epoch. */
  public abstract double initialLoss();

  /** Mean training loss of the last epoch. */
  public abstract double finalLoss();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setConverged(boolean converged);

    public abstract Builder setEarlyStopped(boolean earlyStopped);

    public abstract Builder setEpochs(int epochs);

    public abstract Builder setInitialLoss(double initialLoss);

    public abstract Builder setFinalLoss(double finalLoss);

    public abstract FitResult build();
  }
}
