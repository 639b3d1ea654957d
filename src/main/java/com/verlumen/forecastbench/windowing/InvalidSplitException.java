package com.verlumen.forecastbench.windowing;

import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** Raised when a train/evaluation split would leave either side empty. */
public final class InvalidSplitException extends HarnessException {
  public InvalidSplitException(String message) {
    super(ErrorKind.INVALID_SPLIT, message);
  }
}
