package com.verlumen.forecastbench.models;

import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** Raised when a trainable model is asked to predict before it was fitted. */
public final class NotFittedException extends HarnessException {
  public NotFittedException(String modelName) {
    super(
        ErrorKind.NOT_FITTED,
        String.format("Model '%s' must be fitted before predict", modelName));
  }
}
