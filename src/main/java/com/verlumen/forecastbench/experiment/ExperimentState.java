package com.verlumen.forecastbench.experiment;

/** Lifecycle of a single benchmark run. {@link #REPORTED} and {@link #FAILED} are terminal. */
public enum ExperimentState {
  CONFIGURED,
  DATA_LOADED,
  WINDOWS_BUILT,
  MODEL_FIT,
  EVALUATED,
  REPORTED,
  FAILED;

  public boolean isTerminal() {
    return this == REPORTED || this == FAILED;
  }
}
