package com.verlumen.forecastbench.experiment;

import com.verlumen.forecastbench.reporting.RunReport;
import java.util.Optional;

/**
 * Drives one benchmark run from configuration to report.
 *
 * <p>A run moves through {@link ExperimentState#CONFIGURED}, {@code DATA_LOADED}, {@code
 * WINDOWS_BUILT}, {@code MODEL_FIT} and {@code EVALUATED} to {@link ExperimentState#REPORTED}. Any
 * failure moves it to {@link ExperimentState#FAILED} and is rethrown unchanged; there are no
 * retries. An orchestrator runs at most once.
 */
public interface ExperimentOrchestrator {
  /**
   * Runs the experiment.
   *
   * @return the report of the completed run
   * @throws com.verlumen.forecastbench.errors.HarnessException on a classified failure
   * @throws java.util.concurrent.CancellationException if the thread was interrupted
   * @throws IllegalStateException if the orchestrator already ran
   */
  RunReport run();

  ExperimentState state();

  /** The error that failed the run, if it did. */
  Optional<Throwable> failure();

  interface Factory {
    ExperimentOrchestrator create(ExperimentConfig config);
  }
}
