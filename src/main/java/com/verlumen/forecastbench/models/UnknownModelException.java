package com.verlumen.forecastbench.models;

import com.google.common.collect.ImmutableList;
import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** Raised when {@code --model} names no registered variant. */
public final class UnknownModelException extends HarnessException {
  private final String modelName;

  public UnknownModelException(String modelName, ImmutableList<String> knownModels) {
    super(
        ErrorKind.UNKNOWN_MODEL,
        String.format("Unknown model '%s'; expected one of %s", modelName, knownModels));
    this.modelName = modelName;
  }

  public String modelName() {
    return modelName;
  }
}
