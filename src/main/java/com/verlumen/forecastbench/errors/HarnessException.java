package com.verlumen.forecastbench.errors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class of every fatal error raised by the harness.
 *
 * <p>Subclasses live next to the component that raises them. The orchestrator propagates them
 * unchanged and the command line maps {@link #kind()} to the process exit code.
 */
public abstract class HarnessException extends RuntimeException {
  private final ErrorKind kind;

  protected HarnessException(ErrorKind kind, String message) {
    super(message);
    this.kind = checkNotNull(kind);
  }

  protected HarnessException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = checkNotNull(kind);
  }

  public ErrorKind kind() {
    return kind;
  }
}
