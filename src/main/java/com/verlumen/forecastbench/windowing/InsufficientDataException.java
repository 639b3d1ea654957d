package com.verlumen.forecastbench.windowing;

import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** Raised when a series is shorter than one window plus one horizon. */
public final class InsufficientDataException extends HarnessException {
  private final int available;
  private final long required;

  public InsufficientDataException(int available, long required) {
    super(
        ErrorKind.INSUFFICIENT_DATA,
        String.format(
            "Series has %d samples but at least %d are needed (window_size + horizon)",
            available, required));
    this.available = available;
    this.required = required;
  }

  public int available() {
    return available;
  }

  public long required() {
    return required;
  }
}
