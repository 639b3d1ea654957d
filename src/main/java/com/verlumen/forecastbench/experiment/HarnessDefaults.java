package com.verlumen.forecastbench.experiment;

/**
 * HarnessDefaults holds the default values of run settings that have one.
 */
public final class HarnessDefaults {

  /** Series file read when no dataset is given */
  public static final String DATASET = "data/JSE_clean_truncated.csv";

  /** Column delimiter of the series file */
  public static final char DELIMITER = ',';

  /** Distance between consecutive window starts */
  public static final int STRIDE = 1;

  /** Share of window pairs held out for evaluation */
  public static final double EVAL_FRACTION = 0.2;

  /** Metrics reported when none are selected */
  public static final String METRICS = "mae,rmse,mape";

  /** Root directory of written reports */
  public static final String OUTPUT_DIR = "output";

  // Private constructor to prevent instantiation
  private HarnessDefaults() {
    throw new UnsupportedOperationException(
        "HarnessDefaults is a utility class and cannot be instantiated.");
  }
}
