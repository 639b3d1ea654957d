package com.verlumen.forecastbench.series;

import com.verlumen.forecastbench.errors.ErrorKind;
import com.verlumen.forecastbench.errors.HarnessException;

/** Raised when a series cannot be read or fails validation. */
public final class DataSourceException extends HarnessException {
  public DataSourceException(String message) {
    super(ErrorKind.DATA_SOURCE, message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(ErrorKind.DATA_SOURCE, message, cause);
  }
}
