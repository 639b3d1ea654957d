package com.verlumen.forecastbench.experiment;

import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** A run setting is missing, malformed or inconsistent with another one. */
public final class ConfigurationException extends HarnessException {
  public ConfigurationException(String message) {
    super(ErrorKind.CONFIGURATION, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
