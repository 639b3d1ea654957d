package com.verlumen.forecastbench.errors;

/**
 * Classifies the fatal failures a benchmark run can end in.
 *
 * <p>Each kind owns a distinct process exit code so that callers wrapping the harness can tell a
 * bad data file from a typo in {@code --model} without parsing stderr.
 */
public enum ErrorKind {
  CONFIGURATION(2),
  DATA_SOURCE(3),
  INSUFFICIENT_DATA(4),
  INVALID_SPLIT(5),
  UNKNOWN_MODEL(6),
  NOT_FITTED(7);

  /** Exit code used for failures that are not {@link HarnessException}s. */
  public static final int UNEXPECTED_EXIT_CODE = 1;

  private final int exitCode;

  ErrorKind(int exitCode) {
    this.exitCode = exitCode;
  }

  public int getExitCode() {
    return exitCode;
  }
}
